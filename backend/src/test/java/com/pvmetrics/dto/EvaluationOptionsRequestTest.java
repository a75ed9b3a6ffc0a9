package com.pvmetrics.dto;

import com.pvmetrics.baseline.BaselineType;
import com.pvmetrics.exception.InvalidEvaluationOptionsException;
import com.pvmetrics.model.EvaluationOptions;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EvaluationOptionsRequestTest {

    private final EvaluationOptions defaults = EvaluationOptions.builder().build();

    @Test
    void applyTo_noOverrides_keepsDefaults() {
        assertThat(EvaluationOptionsRequest.builder().build().applyTo(defaults)).isEqualTo(defaults);
    }

    @Test
    void applyTo_overridesOnlySuppliedFields() {
        EvaluationOptionsRequest request = EvaluationOptionsRequest.builder()
            .baselines(List.of(BaselineType.ZERO))
            .season(false)
            .zoneId("Europe/Madrid")
            .build();

        EvaluationOptions options = request.applyTo(defaults);

        assertThat(options.getBaselines()).containsExactly(BaselineType.ZERO);
        assertThat(options.isSeason()).isFalse();
        assertThat(options.getZoneId()).isEqualTo(ZoneId.of("Europe/Madrid"));
        assertThat(options.isNormalize()).isEqualTo(defaults.isNormalize());
        assertThat(options.getTimeOfDayBucketMinutes()).isEqualTo(defaults.getTimeOfDayBucketMinutes());
    }

    @Test
    void applyTo_unknownZone_throws() {
        EvaluationOptionsRequest request = EvaluationOptionsRequest.builder().zoneId("Mars/Olympus").build();

        assertThatThrownBy(() -> request.applyTo(defaults))
            .isInstanceOf(InvalidEvaluationOptionsException.class)
            .hasMessageContaining("Mars/Olympus");
    }

    @Test
    void applyTo_nullBaseline_isLeftForValidation() {
        EvaluationOptionsRequest request = EvaluationOptionsRequest.builder()
            .baselines(Arrays.asList(BaselineType.ZERO, null))
            .build();

        EvaluationOptions options = request.applyTo(defaults);

        assertThatThrownBy(options::validate)
            .isInstanceOf(InvalidEvaluationOptionsException.class)
            .hasMessageContaining("baselines");
    }
}
