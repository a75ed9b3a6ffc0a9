package com.pvmetrics.metrics;

import java.util.function.ToDoubleBiFunction;

public enum MetricType {
    MAE("mae", ErrorMetrics::meanAbsoluteError),
    RMSE("rmse", ErrorMetrics::rootMeanSquareError),
    MBE("mbe", ErrorMetrics::meanBiasError),
    MAPE("mape", ErrorMetrics::meanAbsolutePercentageError);

    private final String label;
    private final ToDoubleBiFunction<double[], double[]> function;

    MetricType(String label, ToDoubleBiFunction<double[], double[]> function) {
        this.label = label;
        this.function = function;
    }

    public String label() {
        return label;
    }

    public double compute(double[] predicted, double[] observed) {
        return function.applyAsDouble(predicted, observed);
    }
}
