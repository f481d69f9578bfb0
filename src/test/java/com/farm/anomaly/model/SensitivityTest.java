package com.farm.anomaly.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SensitivityTest {

    @Test
    void fromValue_recognizedNames() {
        assertThat(Sensitivity.fromValue("low")).isEqualTo(Sensitivity.LOW);
        assertThat(Sensitivity.fromValue("Medium")).isEqualTo(Sensitivity.MEDIUM);
        assertThat(Sensitivity.fromValue(" HIGH ")).isEqualTo(Sensitivity.HIGH);
    }

    @Test
    void fromValue_unrecognizedFallsBackToMedium() {
        assertThat(Sensitivity.fromValue(null)).isEqualTo(Sensitivity.MEDIUM);
        assertThat(Sensitivity.fromValue("")).isEqualTo(Sensitivity.MEDIUM);
        assertThat(Sensitivity.fromValue("paranoid")).isEqualTo(Sensitivity.MEDIUM);
    }
}
