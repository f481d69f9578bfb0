package com.farm.anomaly.config;

import com.farm.anomaly.model.CriticalBound;
import com.farm.anomaly.model.Sensitivity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Detection settings. Bound once at startup; nothing in the service
 * changes them afterwards.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Z-score at or above which a value is an outlier
    private double zscoreThreshold = 2.5;

    // Multiplier applied to the interquartile range to widen the normal band
    private double iqrMultiplier = 1.5;

    // Relative change from the previous value (0.3 = 30%) that counts as sudden
    private double changeRateThreshold = 0.3;

    // Number of historical values kept per device parameter
    private int windowSize = 20;

    // low / medium / high. Unrecognized values behave as medium.
    private String sensitivity = "medium";

    // Static critical ranges keyed by parameter name
    private Map<String, CriticalBound> criticalBounds = new HashMap<>();

    // Payload fields that are never treated as detection parameters
    private List<String> metadataFields = new ArrayList<>(List.of(
            "device_id", "timestamp", "edge_node", "source", "previous_values", "anomaly_analysis"));

    // Parameter names accepted for detection. Empty accepts any numeric field.
    private List<String> allowedParameters = new ArrayList<>();

    // Distinct parameters tracked per device; further parameters are ignored until the device is reset
    private int maxParametersPerDevice = 32;

    public boolean isParameterAllowed(String parameter) {
        return allowedParameters.isEmpty() || allowedParameters.contains(parameter);
    }

    public Sensitivity resolveSensitivity() {
        return Sensitivity.fromValue(sensitivity);
    }

    public CriticalBound boundsFor(String parameter) {
        return criticalBounds.get(parameter);
    }
}
