package com.pvmetrics.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One observation of one entity at one target time, with the predictions made for it
 * at each forecast horizon.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class EvaluationRow {

    @NotBlank(message = "entityId is required")
    String entityId;

    @NotNull(message = "timestamp is required")
    Instant timestamp;

    Double observed;

    // horizon (steps ahead) -> predicted value
    @Singular
    Map<Integer, Double> predictions;

    Double capacity;
    Double reference;
    Double latitude;
    Double longitude;

    public Double prediction(int horizon) {
        return predictions.get(horizon);
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
