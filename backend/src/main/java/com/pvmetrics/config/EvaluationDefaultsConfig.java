package com.pvmetrics.config;

import com.pvmetrics.baseline.BaselineType;
import com.pvmetrics.exception.InvalidEvaluationOptionsException;
import com.pvmetrics.model.EvaluationOptions;
import com.pvmetrics.model.Hemisphere;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Binds {@code evaluation.defaults.*} into the options used when a caller does not
 * supply its own.
 */
@Slf4j
@Configuration
public class EvaluationDefaultsConfig {

    @Bean
    public EvaluationOptions defaultEvaluationOptions(
            @Value("${evaluation.defaults.normalize:true}") boolean normalize,
            @Value("${evaluation.defaults.baselines:LAST_VALUE,LAST_DAY,REFERENCE,MAX,ZERO}") String baselines,
            @Value("${evaluation.defaults.per-entity:true}") boolean perEntity,
            @Value("${evaluation.defaults.daylight:true}") boolean daylight,
            @Value("${evaluation.defaults.time-of-day:true}") boolean timeOfDay,
            @Value("${evaluation.defaults.part-of-day:false}") boolean partOfDay,
            @Value("${evaluation.defaults.season:true}") boolean season,
            @Value("${evaluation.defaults.time-of-day-bucket-minutes:60}") int bucketMinutes,
            @Value("${evaluation.defaults.zone-id:UTC}") String zoneId,
            @Value("${evaluation.defaults.night-sun-elevation-degrees:-5.0}") double nightSunElevation,
            @Value("${evaluation.defaults.day-start-hour:6}") int dayStartHour,
            @Value("${evaluation.defaults.day-end-hour:18}") int dayEndHour,
            @Value("${evaluation.defaults.hemisphere:NORTHERN}") String hemisphere,
            @Value("${evaluation.defaults.large-error-thresholds:}") String largeErrorThresholds) {

        EvaluationOptions options = EvaluationOptions.builder()
            .normalize(normalize)
            .baselines(parseBaselines(baselines))
            .perEntity(perEntity)
            .daylight(daylight)
            .timeOfDay(timeOfDay)
            .partOfDay(partOfDay)
            .season(season)
            .timeOfDayBucketMinutes(bucketMinutes)
            .zoneId(ZoneId.of(zoneId))
            .nightSunElevationDegrees(nightSunElevation)
            .dayStartHour(dayStartHour)
            .dayEndHour(dayEndHour)
            .hemisphere(Hemisphere.valueOf(hemisphere.trim().toUpperCase(Locale.ROOT)))
            .largeErrorThresholds(parseThresholds(largeErrorThresholds))
            .build();
        options.validate();
        log.info("Evaluation defaults | baselines={} | normalize={} | axes={} | zone={}",
                 options.getBaselines(), options.isNormalize(), options.getRequestedAxes(), options.getZoneId());
        return options;
    }

    static List<BaselineType> parseBaselines(String value) {
        try {
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .map(v -> BaselineType.valueOf(v.toUpperCase(Locale.ROOT)))
                .toList();
        } catch (IllegalArgumentException ex) {
            throw new InvalidEvaluationOptionsException("Unknown baseline in '" + value + "'", ex);
        }
    }

    static List<Double> parseThresholds(String value) {
        try {
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .map(Double::valueOf)
                .toList();
        } catch (NumberFormatException ex) {
            throw new InvalidEvaluationOptionsException("Invalid large error thresholds '" + value + "'", ex);
        }
    }
}
