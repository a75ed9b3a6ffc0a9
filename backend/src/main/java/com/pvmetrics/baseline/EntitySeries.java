package com.pvmetrics.baseline;

import java.time.Instant;

/**
 * One entity's time-ordered observations, with the context the baselines need.
 * Missing values are NaN; {@code capacity} is NaN when unknown.
 */
public record EntitySeries(String entityId, Instant[] timestamps, double[] observed, double[] reference,
                           double capacity) {

    public EntitySeries {
        if (timestamps.length != observed.length || observed.length != reference.length) {
            throw new IllegalArgumentException("timestamps, observed and reference series must have the same length");
        }
    }

    public int length() {
        return observed.length;
    }

    /**
     * Installed capacity, or the largest observation when the capacity is unknown.
     */
    public double effectiveCapacity() {
        if (Double.isFinite(capacity)) {
            return capacity;
        }
        double max = Double.NaN;
        for (double value : observed) {
            if (Double.isFinite(value) && (Double.isNaN(max) || value > max)) {
                max = value;
            }
        }
        return max;
    }
}
