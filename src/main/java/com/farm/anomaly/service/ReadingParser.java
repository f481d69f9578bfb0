package com.farm.anomaly.service;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.model.SensorReading;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Decodes an incoming JSON reading into a {@link SensorReading}.
 *
 * Expected shape: {"device_id": "...", "timestamp": 1739886764.5, "N": 90, "ph": 6.5, ...}.
 * device_id is required. timestamp is epoch seconds; when absent the reading
 * is stamped once, here, from the service clock. Every numeric field that is
 * not a configured metadata field, and is on the allow-list when one is
 * configured, becomes a detection parameter. An optional
 * "previous_values" object overrides the stored previous value per parameter.
 */
@Component
public class ReadingParser {

    private static final Logger log = LoggerFactory.getLogger(ReadingParser.class);

    static final String FIELD_DEVICE_ID = "device_id";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_PREVIOUS_VALUES = "previous_values";

    private final ObjectMapper objectMapper;
    private final DetectionConfig config;
    private final Clock clock;

    public ReadingParser(ObjectMapper objectMapper, DetectionConfig config, Clock clock) {
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
    }

    public SensorReading parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedReadingException("payload", "Reading payload is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedReadingException("payload", "Undecodable reading payload: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public SensorReading parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedReadingException("payload", "Reading payload must be a JSON object");
        }

        JsonNode deviceNode = root.get(FIELD_DEVICE_ID);
        if (deviceNode == null || !deviceNode.isTextual() || deviceNode.asText().isBlank()) {
            throw new MalformedReadingException(FIELD_DEVICE_ID, "device_id is required");
        }
        String deviceId = deviceNode.asText();

        long timestamp = resolveTimestamp(root.get(FIELD_TIMESTAMP));
        Map<String, Double> previousOverrides = parsePreviousValues(root.get(FIELD_PREVIOUS_VALUES));

        Map<String, Double> parameters = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (config.getMetadataFields().contains(name)) {
                continue;
            }
            JsonNode node = field.getValue();
            if (!config.isParameterAllowed(name)) {
                log.debug("Skipping field '{}' outside the parameter allow-list from device={}", name, deviceId);
                continue;
            }
            if (!node.isNumber() || !Double.isFinite(node.asDouble())) {
                log.debug("Skipping non-numeric field '{}' in reading from device={}", name, deviceId);
                continue;
            }
            parameters.put(name, node.asDouble());
        }

        if (parameters.isEmpty()) {
            throw new MalformedReadingException("parameters", "Reading from " + deviceId + " carries no numeric parameters");
        }

        Map<String, Object> payload = objectMapper.convertValue(root, new TypeReference<LinkedHashMap<String, Object>>() {});

        return SensorReading.builder()
                .readingId(UUID.randomUUID().toString())
                .deviceId(deviceId)
                .timestamp(timestamp)
                .parameters(parameters)
                .previousOverrides(previousOverrides)
                .payload(payload)
                .build();
    }

    private long resolveTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return clock.millis();
        }
        if (!node.isNumber() || !Double.isFinite(node.asDouble())) {
            throw new MalformedReadingException(FIELD_TIMESTAMP, "timestamp must be epoch seconds");
        }
        return Math.round(node.asDouble() * 1000.0);
    }

    private Map<String, Double> parsePreviousValues(JsonNode node) {
        Map<String, Double> overrides = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return overrides;
        }
        if (!node.isObject()) {
            throw new MalformedReadingException(FIELD_PREVIOUS_VALUES, "previous_values must be an object of numbers");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new MalformedReadingException(FIELD_PREVIOUS_VALUES,
                        "previous_values." + field.getKey() + " must be numeric");
            }
            overrides.put(field.getKey(), field.getValue().asDouble());
        }
        return overrides;
    }
}
