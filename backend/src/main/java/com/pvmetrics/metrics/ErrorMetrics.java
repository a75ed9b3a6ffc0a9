package com.pvmetrics.metrics;

/**
 * Scalar error statistics between aligned predicted and observed values.
 *
 * <p>Inputs must already be aligned and NaN-filtered. An empty input yields NaN.
 */
public final class ErrorMetrics {
    private ErrorMetrics() {
    }

    public static double meanAbsoluteError(double[] predicted, double[] observed) {
        checkAligned(predicted, observed);
        if (predicted.length == 0) {
            return Double.NaN;
        }
        double absErrorSum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            absErrorSum += Math.abs(predicted[i] - observed[i]);
        }
        return absErrorSum / predicted.length;
    }

    public static double rootMeanSquareError(double[] predicted, double[] observed) {
        checkAligned(predicted, observed);
        if (predicted.length == 0) {
            return Double.NaN;
        }
        double squaredErrorSum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            double error = predicted[i] - observed[i];
            squaredErrorSum += error * error;
        }
        return Math.sqrt(squaredErrorSum / predicted.length);
    }

    /**
     * Positive when the predictions run high.
     */
    public static double meanBiasError(double[] predicted, double[] observed) {
        checkAligned(predicted, observed);
        if (predicted.length == 0) {
            return Double.NaN;
        }
        double errorSum = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            errorSum += predicted[i] - observed[i];
        }
        return errorSum / predicted.length;
    }

    /**
     * Mean of |error| / |observed| as a fraction, over the rows where observed is non-zero.
     */
    public static double meanAbsolutePercentageError(double[] predicted, double[] observed) {
        checkAligned(predicted, observed);
        double apeSum = 0.0;
        int apeCount = 0;
        for (int i = 0; i < predicted.length; i++) {
            double actual = observed[i];
            if (actual != 0.0d) {
                apeSum += Math.abs((predicted[i] - actual) / actual);
                apeCount++;
            }
        }
        return apeCount > 0 ? apeSum / apeCount : Double.NaN;
    }

    /**
     * Number of rows whose absolute error is strictly above {@code threshold}.
     */
    public static double countLargeErrors(double[] predicted, double[] observed, double threshold) {
        checkAligned(predicted, observed);
        if (predicted.length == 0) {
            return Double.NaN;
        }
        int count = 0;
        for (int i = 0; i < predicted.length; i++) {
            if (Math.abs(predicted[i] - observed[i]) > threshold) {
                count++;
            }
        }
        return count;
    }

    private static void checkAligned(double[] predicted, double[] observed) {
        if (predicted.length != observed.length) {
            throw new IllegalArgumentException("predicted and observed must have the same length, got "
                + predicted.length + " and " + observed.length);
        }
    }
}
