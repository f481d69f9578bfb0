package com.farm.anomaly.engine;

import com.farm.anomaly.model.AnomalyReport;
import com.farm.anomaly.model.Finding;
import com.farm.anomaly.model.Sensitivity;
import com.farm.anomaly.model.Severity;
import com.farm.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ForwardingPolicyTest {

    private final ForwardingPolicy policy = new ForwardingPolicy();

    @Test
    void lowSensitivity_escalatesOnlyCritical() {
        assertThat(policy.shouldEscalate(Severity.CRITICAL, Sensitivity.LOW)).isTrue();
        assertThat(policy.shouldEscalate(Severity.HIGH, Sensitivity.LOW)).isFalse();
        assertThat(policy.shouldEscalate(Severity.MEDIUM, Sensitivity.LOW)).isFalse();
        assertThat(policy.shouldEscalate(Severity.NORMAL, Sensitivity.LOW)).isFalse();
    }

    @Test
    void mediumSensitivity_escalatesHighAndCritical() {
        assertThat(policy.shouldEscalate(Severity.CRITICAL, Sensitivity.MEDIUM)).isTrue();
        assertThat(policy.shouldEscalate(Severity.HIGH, Sensitivity.MEDIUM)).isTrue();
        assertThat(policy.shouldEscalate(Severity.MEDIUM, Sensitivity.MEDIUM)).isFalse();
        assertThat(policy.shouldEscalate(Severity.NORMAL, Sensitivity.MEDIUM)).isFalse();
    }

    @Test
    void highSensitivity_escalatesEverythingButNormal() {
        assertThat(policy.shouldEscalate(Severity.CRITICAL, Sensitivity.HIGH)).isTrue();
        assertThat(policy.shouldEscalate(Severity.HIGH, Sensitivity.HIGH)).isTrue();
        assertThat(policy.shouldEscalate(Severity.MEDIUM, Sensitivity.HIGH)).isTrue();
        assertThat(policy.shouldEscalate(Severity.NORMAL, Sensitivity.HIGH)).isFalse();
    }

    @Test
    void normalNeverEscalates() {
        for (Sensitivity sensitivity : Sensitivity.values()) {
            assertThat(policy.shouldEscalate(Severity.NORMAL, sensitivity)).isFalse();
        }
    }

    @Test
    void criticalAlwaysEscalates() {
        for (Sensitivity sensitivity : Sensitivity.values()) {
            assertThat(policy.shouldEscalate(Severity.CRITICAL, sensitivity)).isTrue();
        }
    }

    @Test
    void raisingSensitivity_neverShrinksEscalatingSet() {
        assertThat(policy.escalatingSeverities(Sensitivity.MEDIUM))
                .containsAll(policy.escalatingSeverities(Sensitivity.LOW));
        assertThat(policy.escalatingSeverities(Sensitivity.HIGH))
                .containsAll(policy.escalatingSeverities(Sensitivity.MEDIUM));
    }

    @Test
    void unrecognizedSensitivityName_behavesAsMedium() {
        for (Severity severity : Severity.values()) {
            boolean expected = policy.shouldEscalate(severity, Sensitivity.MEDIUM);
            assertThat(policy.shouldEscalate(severity, "extreme")).isEqualTo(expected);
            assertThat(policy.shouldEscalate(severity, "")).isEqualTo(expected);
            assertThat(policy.shouldEscalate(severity, (String) null)).isEqualTo(expected);
        }
    }

    @Test
    void sensitivityName_isCaseInsensitive() {
        assertThat(policy.shouldEscalate(Severity.MEDIUM, "HIGH")).isTrue();
        assertThat(policy.shouldEscalate(Severity.HIGH, " low ")).isFalse();
    }

    @Test
    void nullSensitivity_behavesAsMedium() {
        assertThat(policy.shouldEscalate(Severity.HIGH, (Sensitivity) null)).isTrue();
        assertThat(policy.shouldEscalate(Severity.MEDIUM, (Sensitivity) null)).isFalse();
    }

    @Test
    void isNormal_trueOnlyWithoutFindings() {
        AnomalyReport normal = TestDataFactory.createReport("N", 50.0);
        AnomalyReport flagged = TestDataFactory.createReport("N", 120.0, Finding.zscore(58.4));

        assertThat(policy.isNormal(normal)).isTrue();
        assertThat(policy.isNormal(flagged)).isFalse();
    }
}
