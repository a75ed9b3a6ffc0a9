package com.pvmetrics.baseline;

import java.util.Arrays;
import java.util.function.ToDoubleFunction;

/**
 * Predicts the same value at every timestep: zero, or the entity's capacity.
 */
public class ConstantBaseline implements BaselineGenerator {

    private final BaselineType type;
    private final ToDoubleFunction<EntitySeries> level;

    private ConstantBaseline(BaselineType type, ToDoubleFunction<EntitySeries> level) {
        this.type = type;
        this.level = level;
    }

    public static ConstantBaseline zero() {
        return new ConstantBaseline(BaselineType.ZERO, s -> 0.0);
    }

    public static ConstantBaseline max() {
        return new ConstantBaseline(BaselineType.MAX, EntitySeries::effectiveCapacity);
    }

    @Override
    public BaselineType type() {
        return type;
    }

    @Override
    public double[] generate(EntitySeries series) {
        double[] baseline = new double[series.length()];
        Arrays.fill(baseline, level.applyAsDouble(series));
        return baseline;
    }
}
