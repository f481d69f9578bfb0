package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.util.List;

/**
 * Detection outcome for one parameter of one reading. Severity is derived
 * from the number of findings and cannot be set independently.
 */
@Value
@Schema(description = "Anomaly report for a single parameter of a reading")
public class AnomalyReport {

    @Schema(description = "Parameter name", example = "N")
    String parameter;

    @JsonProperty("current_value")
    @Schema(description = "Evaluated value", example = "120.0")
    double value;

    @Schema(description = "Reading timestamp in epoch milliseconds", example = "1739886764000")
    long timestamp;

    @JsonProperty("anomalies_detected")
    @Schema(description = "Findings in method order: zscore, iqr, change_rate, threshold")
    List<Finding> findings;

    @Schema(description = "Severity derived from the finding count", example = "high")
    Severity severity;

    @JsonCreator
    public AnomalyReport(@JsonProperty("parameter") String parameter,
                         @JsonProperty("current_value") double value,
                         @JsonProperty("timestamp") long timestamp,
                         @JsonProperty("anomalies_detected") List<Finding> findings) {
        this.parameter = parameter;
        this.value = value;
        this.timestamp = timestamp;
        this.findings = findings == null ? List.of() : List.copyOf(findings);
        this.severity = Severity.fromFindingCount(this.findings.size());
    }

    @JsonIgnore
    public boolean isNormal() {
        return findings.isEmpty();
    }
}
