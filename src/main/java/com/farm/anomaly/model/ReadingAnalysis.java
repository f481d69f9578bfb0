package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Result of running anomaly detection over every parameter of a reading")
public class ReadingAnalysis {

    @Schema(description = "Identifier of the analysed reading", example = "1f0c6a52-8d3e-4b8e-9f7a-2c1d3e4f5a6b")
    private String readingId;

    @Schema(description = "Reporting device identifier", example = "device_germany")
    private String deviceId;

    @Schema(description = "Reading timestamp in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Per-parameter anomaly reports, in payload order")
    private Map<String, AnomalyReport> reports;

    @Schema(description = "Highest severity across all parameters", example = "high")
    private Severity overallSeverity;

    @Schema(description = "Whether the enriched reading was handed to the alerting endpoint", example = "true")
    private boolean forwarded;

    @Schema(description = "Sensitivity tier the escalation decision used", example = "medium")
    private Sensitivity sensitivity;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "Soil classification and crop ranking; present only on forwarded readings carrying N, P, K and ph")
    private SoilAssessment soilAssessment;
}
