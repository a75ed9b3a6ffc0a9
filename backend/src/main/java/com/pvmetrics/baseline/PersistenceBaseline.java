package com.pvmetrics.baseline;

import com.pvmetrics.exception.InsufficientHistoryException;

import java.util.Arrays;

/**
 * Repeats the observation a fixed number of rows back: {@code b[t] = observed[t - lag]}.
 */
public class PersistenceBaseline implements BaselineGenerator {

    private final BaselineType type;
    private final int lagSteps;

    PersistenceBaseline(BaselineType type, int lagSteps) {
        if (lagSteps < 1) {
            throw new IllegalArgumentException("lagSteps must be >= 1, got " + lagSteps);
        }
        this.type = type;
        this.lagSteps = lagSteps;
    }

    public static PersistenceBaseline lastValue() {
        return new PersistenceBaseline(BaselineType.LAST_VALUE, 1);
    }

    @Override
    public BaselineType type() {
        return type;
    }

    public int lagSteps() {
        return lagSteps;
    }

    @Override
    public double[] generate(EntitySeries series) {
        double[] observed = series.observed();
        if (observed.length <= lagSteps) {
            throw new InsufficientHistoryException(series.entityId(),
                "a lag of " + lagSteps + " steps needs more than " + observed.length + " observations");
        }
        double[] baseline = new double[observed.length];
        Arrays.fill(baseline, 0, lagSteps, Double.NaN);
        System.arraycopy(observed, 0, baseline, lagSteps, observed.length - lagSteps);
        return baseline;
    }
}
