package com.pvmetrics.dto;

import com.pvmetrics.baseline.BaselineType;
import com.pvmetrics.exception.InvalidEvaluationOptionsException;
import com.pvmetrics.model.EvaluationOptions;
import com.pvmetrics.model.Hemisphere;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Per-request overrides; any field left null keeps the service default.
 */
@Value
@Builder
@Jacksonized
public class EvaluationOptionsRequest {
    Boolean normalize;
    List<BaselineType> baselines;
    Boolean perEntity;
    Boolean daylight;
    Boolean timeOfDay;
    Boolean partOfDay;
    Boolean season;

    @Min(value = 1, message = "timeOfDayBucketMinutes must be >= 1")
    @Max(value = 1440, message = "timeOfDayBucketMinutes must be <= 1440")
    Integer timeOfDayBucketMinutes;

    String zoneId;
    Double nightSunElevationDegrees;

    @Min(value = 0, message = "dayStartHour must be between 0 and 23")
    @Max(value = 23, message = "dayStartHour must be between 0 and 23")
    Integer dayStartHour;

    @Min(value = 1, message = "dayEndHour must be between 1 and 24")
    @Max(value = 24, message = "dayEndHour must be between 1 and 24")
    Integer dayEndHour;

    Hemisphere hemisphere;
    Map<String, List<Integer>> partOfDayHours;
    List<Double> largeErrorThresholds;

    public EvaluationOptions applyTo(EvaluationOptions defaults) {
        EvaluationOptions.EvaluationOptionsBuilder builder = defaults.toBuilder();
        if (normalize != null) builder.normalize(normalize);
        if (baselines != null) builder.baselines(Collections.unmodifiableList(new ArrayList<>(baselines)));
        if (perEntity != null) builder.perEntity(perEntity);
        if (daylight != null) builder.daylight(daylight);
        if (timeOfDay != null) builder.timeOfDay(timeOfDay);
        if (partOfDay != null) builder.partOfDay(partOfDay);
        if (season != null) builder.season(season);
        if (timeOfDayBucketMinutes != null) builder.timeOfDayBucketMinutes(timeOfDayBucketMinutes);
        if (nightSunElevationDegrees != null) builder.nightSunElevationDegrees(nightSunElevationDegrees);
        if (dayStartHour != null) builder.dayStartHour(dayStartHour);
        if (dayEndHour != null) builder.dayEndHour(dayEndHour);
        if (hemisphere != null) builder.hemisphere(hemisphere);
        if (partOfDayHours != null) builder.partOfDayHours(partOfDayHours);
        if (largeErrorThresholds != null) builder.largeErrorThresholds(largeErrorThresholds);
        if (zoneId != null) {
            try {
                builder.zoneId(ZoneId.of(zoneId));
            } catch (DateTimeException ex) {
                throw new InvalidEvaluationOptionsException("Unknown zoneId '" + zoneId + "'", ex);
            }
        }
        return builder.build();
    }
}
