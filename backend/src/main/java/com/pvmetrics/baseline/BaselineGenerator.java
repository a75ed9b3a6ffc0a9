package com.pvmetrics.baseline;

/**
 * Produces a model-free reference forecast for one entity, aligned one-to-one with its
 * observations. Values that cannot be computed are NaN.
 */
public interface BaselineGenerator {

    BaselineType type();

    /**
     * @throws com.pvmetrics.exception.InsufficientHistoryException when the entity's history
     *         is shorter than the lookback the baseline needs
     */
    double[] generate(EntitySeries series);
}
