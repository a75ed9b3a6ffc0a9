package com.pvmetrics.baseline;

/**
 * An externally supplied estimate scored as a baseline, never as ground truth.
 */
public class ReferenceSeriesBaseline implements BaselineGenerator {

    @Override
    public BaselineType type() {
        return BaselineType.REFERENCE;
    }

    @Override
    public double[] generate(EntitySeries series) {
        return series.reference().clone();
    }
}
