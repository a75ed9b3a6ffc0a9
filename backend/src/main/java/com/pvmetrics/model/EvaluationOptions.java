package com.pvmetrics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pvmetrics.baseline.BaselineType;
import com.pvmetrics.exception.InvalidEvaluationOptionsException;
import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything an evaluation can be told. The defaults compute everything: all baselines,
 * normalized values and the per-entity breakdown.
 */
@Value
@Builder(toBuilder = true)
public class EvaluationOptions {

    private static final int MINUTES_PER_DAY = 24 * 60;

    @Builder.Default
    boolean normalize = true;

    @Builder.Default
    List<BaselineType> baselines = List.of(BaselineType.values());

    @Builder.Default
    boolean perEntity = true;

    @Builder.Default
    boolean daylight = true;

    @Builder.Default
    boolean timeOfDay = true;

    @Builder.Default
    boolean partOfDay = false;

    @Builder.Default
    boolean season = true;

    @Builder.Default
    int timeOfDayBucketMinutes = 60;

    @Builder.Default
    ZoneId zoneId = ZoneOffset.UTC;

    // sun elevation at or below this is night
    @Builder.Default
    double nightSunElevationDegrees = -5.0;

    // local-hour window used for rows without a location
    @Builder.Default
    int dayStartHour = 6;

    @Builder.Default
    int dayEndHour = 18;

    @Builder.Default
    Hemisphere hemisphere = Hemisphere.NORTHERN;

    @Builder.Default
    Map<String, List<Integer>> partOfDayHours = defaultPartOfDayHours();

    @Builder.Default
    List<Double> largeErrorThresholds = List.of();

    public static Map<String, List<Integer>> defaultPartOfDayHours() {
        Map<String, List<Integer>> hours = new LinkedHashMap<>();
        hours.put("night", List.of(21, 22, 23, 0, 1, 2, 3));
        hours.put("morning", List.of(4, 5, 6, 7, 8, 9));
        hours.put("afternoon", List.of(10, 11, 12, 13, 14, 15));
        hours.put("evening", List.of(16, 17, 18, 19, 20));
        return Collections.unmodifiableMap(hours);
    }

    /**
     * Axes to slice by, in the order they appear in segment keys.
     */
    @JsonIgnore
    public List<SegmentAxis> getRequestedAxes() {
        List<SegmentAxis> axes = new ArrayList<>();
        if (daylight) {
            axes.add(SegmentAxis.DAYLIGHT);
        }
        if (timeOfDay) {
            axes.add(SegmentAxis.TIME_OF_DAY);
        }
        if (partOfDay) {
            axes.add(SegmentAxis.PART_OF_DAY);
        }
        if (season) {
            axes.add(SegmentAxis.SEASON);
        }
        if (perEntity) {
            axes.add(SegmentAxis.ENTITY);
        }
        return axes;
    }

    public void validate() {
        if (baselines == null || zoneId == null || hemisphere == null
                || partOfDayHours == null || largeErrorThresholds == null) {
            throw new InvalidEvaluationOptionsException("evaluation options must not contain null values");
        }
        if (baselines.stream().anyMatch(Objects::isNull) || new HashSet<>(baselines).size() != baselines.size()) {
            throw new InvalidEvaluationOptionsException("baselines must not contain nulls or repeats");
        }
        if (timeOfDayBucketMinutes < 1 || MINUTES_PER_DAY % timeOfDayBucketMinutes != 0) {
            throw new InvalidEvaluationOptionsException(
                "timeOfDayBucketMinutes must divide a day evenly, got " + timeOfDayBucketMinutes);
        }
        if (dayStartHour < 0 || dayEndHour > 24 || dayStartHour >= dayEndHour) {
            throw new InvalidEvaluationOptionsException(
                "dayStartHour and dayEndHour must satisfy 0 <= start < end <= 24");
        }
        if (Double.isNaN(nightSunElevationDegrees)) {
            throw new InvalidEvaluationOptionsException("nightSunElevationDegrees must be a number");
        }
        for (Double threshold : largeErrorThresholds) {
            if (threshold == null || !Double.isFinite(threshold) || threshold < 0) {
                throw new InvalidEvaluationOptionsException(
                    "largeErrorThresholds must be finite and >= 0, got " + threshold);
            }
        }
        if (new HashSet<>(largeErrorThresholds).size() != largeErrorThresholds.size()) {
            throw new InvalidEvaluationOptionsException("largeErrorThresholds must not contain repeats");
        }
        if (partOfDay) {
            validatePartOfDayHours();
        }
    }

    private void validatePartOfDayHours() {
        Set<Integer> seen = new HashSet<>();
        for (Map.Entry<String, List<Integer>> part : partOfDayHours.entrySet()) {
            if (part.getKey() == null || part.getKey().isBlank() || SegmentKey.ALL.equals(part.getKey())
                    || part.getValue() == null) {
                throw new InvalidEvaluationOptionsException("each part of day needs a name other than 'all' and a list of hours");
            }
            for (Integer hour : part.getValue()) {
                if (hour == null || hour < 0 || hour > 23) {
                    throw new InvalidEvaluationOptionsException(
                        "part of day '" + part.getKey() + "' has an invalid hour " + hour);
                }
                if (!seen.add(hour)) {
                    throw new InvalidEvaluationOptionsException("hour " + hour + " belongs to more than one part of day");
                }
            }
        }
        if (seen.size() != 24) {
            throw new InvalidEvaluationOptionsException("parts of day must cover all 24 hours");
        }
    }
}
