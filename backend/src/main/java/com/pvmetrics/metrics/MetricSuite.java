package com.pvmetrics.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed, ordered set of metrics every segment is scored with: the four error
 * statistics plus one large-error count per configured threshold.
 */
public class MetricSuite {

    private final List<Double> largeErrorThresholds;
    private final List<String> names;

    public MetricSuite(List<Double> largeErrorThresholds) {
        this.largeErrorThresholds = List.copyOf(largeErrorThresholds);
        List<String> all = new ArrayList<>();
        for (MetricType type : MetricType.values()) {
            all.add(type.label());
        }
        for (double threshold : this.largeErrorThresholds) {
            all.add(largeErrorName(threshold));
        }
        this.names = Collections.unmodifiableList(all);
    }

    public static String largeErrorName(double threshold) {
        return "large_error_count_threshold_" + threshold;
    }

    public List<String> names() {
        return names;
    }

    public Map<String, Double> score(double[] predicted, double[] observed) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (MetricType type : MetricType.values()) {
            scores.put(type.label(), type.compute(predicted, observed));
        }
        for (double threshold : largeErrorThresholds) {
            scores.put(largeErrorName(threshold), ErrorMetrics.countLargeErrors(predicted, observed, threshold));
        }
        return Collections.unmodifiableMap(scores);
    }
}
