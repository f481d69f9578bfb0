package com.farm.anomaly.controller;

import com.farm.anomaly.config.AerospikeConfig;
import com.farm.anomaly.config.DetectionConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the startup configuration (read-only)")
public class ConfigController {

    private final DetectionConfig detectionConfig;
    private final AerospikeConfig aerospikeConfig;

    public ConfigController(DetectionConfig detectionConfig, AerospikeConfig aerospikeConfig) {
        this.detectionConfig = detectionConfig;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Detection ──

    @Operation(summary = "Get detection configuration",
            description = "Thresholds, window size, resolved sensitivity and critical bounds. Fixed at startup.")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("zscoreThreshold", detectionConfig.getZscoreThreshold());
        body.put("iqrMultiplier", detectionConfig.getIqrMultiplier());
        body.put("changeRateThreshold", detectionConfig.getChangeRateThreshold());
        body.put("windowSize", detectionConfig.getWindowSize());
        body.put("sensitivity", detectionConfig.resolveSensitivity());
        body.put("criticalBounds", detectionConfig.getCriticalBounds());
        body.put("metadataFields", detectionConfig.getMetadataFields());
        body.put("allowedParameters", detectionConfig.getAllowedParameters());
        body.put("maxParametersPerDevice", detectionConfig.getMaxParametersPerDevice());
        return ResponseEntity.ok(body);
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace(),
                "readingTtlSeconds", aerospikeConfig.getReadingTtlSeconds()
        ));
    }
}
