package com.pvmetrics.dto;

import com.pvmetrics.model.EvaluationRow;
import com.pvmetrics.model.EvaluationTable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class EvaluationRequest {

    @NotBlank(message = "modelName is required")
    String modelName;

    @NotNull(message = "horizons is required")
    List<@NotNull Integer> horizons;

    @NotNull(message = "rows is required")
    List<@Valid @NotNull EvaluationRow> rows;

    @Valid
    EvaluationOptionsRequest options;

    public EvaluationTable toTable() {
        return EvaluationTable.builder()
            .horizons(horizons)
            .rows(rows)
            .build();
    }
}
