package com.pvmetrics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Scores of one evaluation. {@code metrics} is keyed series/representation, then
 * {@code horizon_<h>}, then segment description, then metric name; {@code overall}
 * repeats the unsliced segment of each series and horizon. NaN marks a score that
 * could not be computed.
 */
@Value
@Builder
public class EvaluationResult {
    String modelName;
    int rowCount;
    List<Integer> horizons;
    List<String> segments;
    Map<String, Map<String, Map<String, Map<String, Double>>>> metrics;
    Map<String, Map<String, Map<String, Double>>> overall;

    public static String seriesKey(String series, Representation representation) {
        return series + "/" + representation.label();
    }

    public static String horizonKey(int horizon) {
        return "horizon_" + horizon;
    }

    public Double metric(String seriesKey, int horizon, String segment, String metric) {
        return metrics.get(seriesKey).get(horizonKey(horizon)).get(segment).get(metric);
    }
}
