package com.jasmin.trafficinsights.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ThresholdMode")
class ThresholdModeTest {

    @Test
    @DisplayName("auto should carry no contamination fraction")
    void autoHasNoFraction() {
        assertThat(ThresholdMode.auto().isAuto()).isTrue();
        assertThatThrownBy(() -> ThresholdMode.auto().getContamination())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("contamination should keep its fraction")
    void contaminationKeepsFraction() {
        ThresholdMode mode = ThresholdMode.contamination(0.05);

        assertThat(mode.isAuto()).isFalse();
        assertThat(mode.getContamination()).isEqualTo(0.05);
        assertThat(mode).isEqualTo(ThresholdMode.contamination(0.05));
    }

    @Test
    @DisplayName("should reject fractions outside (0, 0.5]")
    void shouldRejectOutOfRangeFractions() {
        assertThatThrownBy(() -> ThresholdMode.contamination(0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ThresholdMode.contamination(0.51)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ThresholdMode.contamination(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
