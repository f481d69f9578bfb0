package com.farm.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A decoded sensor reading ready for anomaly detection")
public class SensorReading {

    @Schema(description = "Unique reading identifier, assigned at ingestion", example = "1f0c6a52-8d3e-4b8e-9f7a-2c1d3e4f5a6b")
    private String readingId;

    @Schema(description = "Reporting device identifier", example = "device_germany")
    private String deviceId;

    @Schema(description = "Reading timestamp in epoch milliseconds, assigned once at ingestion", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Numeric parameters used for detection", example = "{\"N\": 90.0, \"ph\": 6.5}")
    @Builder.Default
    private Map<String, Double> parameters = new LinkedHashMap<>();

    @Schema(description = "Per-parameter previous values overriding the stored baseline for this reading only")
    @Builder.Default
    private Map<String, Double> previousOverrides = new LinkedHashMap<>();

    @Schema(description = "The decoded input structure as received, including metadata fields")
    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();
}
