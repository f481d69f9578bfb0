package com.farm.anomaly.engine;

import com.farm.anomaly.model.AnomalyReport;
import com.farm.anomaly.model.Sensitivity;
import com.farm.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a severity warrants escalation under a sensitivity tier.
 *
 * low    -> critical
 * medium -> critical, high
 * high   -> critical, high, medium
 */
@Component
public class ForwardingPolicy {

    private static final Map<Sensitivity, Set<Severity>> ESCALATING_SEVERITIES = buildTable();

    public boolean shouldEscalate(Severity severity, Sensitivity sensitivity) {
        Sensitivity tier = sensitivity != null ? sensitivity : Sensitivity.MEDIUM;
        return ESCALATING_SEVERITIES.get(tier).contains(severity);
    }

    /**
     * Same as {@link #shouldEscalate(Severity, Sensitivity)} for a configured
     * sensitivity name; unrecognized names use the medium tier.
     */
    public boolean shouldEscalate(Severity severity, String sensitivity) {
        return shouldEscalate(severity, Sensitivity.fromValue(sensitivity));
    }

    public boolean isNormal(AnomalyReport report) {
        return report.getFindings().isEmpty();
    }

    public Set<Severity> escalatingSeverities(Sensitivity sensitivity) {
        return Collections.unmodifiableSet(ESCALATING_SEVERITIES.get(sensitivity));
    }

    private static Map<Sensitivity, Set<Severity>> buildTable() {
        Map<Sensitivity, Set<Severity>> table = new EnumMap<>(Sensitivity.class);
        for (Sensitivity sensitivity : Sensitivity.values()) {
            // Exhaustive switch: a new tier does not compile until it is mapped here
            Set<Severity> severities = switch (sensitivity) {
                case LOW -> EnumSet.of(Severity.CRITICAL);
                case MEDIUM -> EnumSet.of(Severity.CRITICAL, Severity.HIGH);
                case HIGH -> EnumSet.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM);
            };
            table.put(sensitivity, severities);
        }
        return table;
    }
}
