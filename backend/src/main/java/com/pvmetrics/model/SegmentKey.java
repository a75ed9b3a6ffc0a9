package com.pvmetrics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Axis -> bucket label for one segment. Axes keep the order they were requested in.
 */
public record SegmentKey(Map<SegmentAxis, String> buckets) {

    public static final String ALL = "all";

    public SegmentKey {
        buckets = Collections.unmodifiableMap(new LinkedHashMap<>(buckets));
    }

    public static SegmentKey unsliced() {
        return new SegmentKey(Map.of());
    }

    public SegmentKey with(SegmentAxis axis, String bucket) {
        Map<SegmentAxis, String> next = new LinkedHashMap<>(buckets);
        next.put(axis, bucket);
        return new SegmentKey(next);
    }

    public String bucket(SegmentAxis axis) {
        return buckets.getOrDefault(axis, ALL);
    }

    public boolean isUnsliced() {
        return buckets.values().stream().allMatch(ALL::equals);
    }

    public String describe() {
        if (isUnsliced()) {
            return ALL;
        }
        return buckets.entrySet().stream()
            .map(e -> e.getKey().label() + "=" + e.getValue())
            .collect(Collectors.joining("/"));
    }
}
