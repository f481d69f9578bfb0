package com.farm.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.farm.anomaly.config.AerospikeConfig;
import com.farm.anomaly.model.SensorReading;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Raw reading archive, one record per reading keyed by its reading id.
 * Records expire after {@code aerospike.reading-ttl-seconds}.
 */
@Repository
public class ReadingRepository {

    private static final Logger log = LoggerFactory.getLogger(ReadingRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public ReadingRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy defaultWritePolicy,
                             AerospikeConfig aerospikeConfig,
                             ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = new WritePolicy(defaultWritePolicy);
        this.writePolicy.expiration = aerospikeConfig.getReadingTtlSeconds();
        this.objectMapper = objectMapper;
    }

    public void save(SensorReading reading) {
        if (reading.getReadingId() == null) {
            reading.setReadingId(UUID.randomUUID().toString());
        }
        Key key = new Key(namespace, AerospikeConfig.SET_READINGS, reading.getReadingId());

        client.put(writePolicy, key,
                new Bin("readingId", reading.getReadingId()),
                new Bin("deviceId", reading.getDeviceId()),
                new Bin("timestamp", reading.getTimestamp()),
                new Bin("params", toJson(reading.getParameters())),
                new Bin("prevOverride", toJson(reading.getPreviousOverrides())),
                new Bin("payload", toJson(reading.getPayload())));
    }

    public List<SensorReading> findRecentByDevice(String deviceId, int limit) {
        List<SensorReading> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_READINGS,
                (key, record) -> {
                    if (deviceId.equals(record.getString("deviceId"))) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });

        results.sort(Comparator.comparingLong(SensorReading::getTimestamp).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private SensorReading mapRecord(Record record) {
        return SensorReading.builder()
                .readingId(record.getString("readingId"))
                .deviceId(record.getString("deviceId"))
                .timestamp(record.getLong("timestamp"))
                .parameters(fromJson(record.getString("params"), new TypeReference<LinkedHashMap<String, Double>>() {}))
                .previousOverrides(fromJson(record.getString("prevOverride"), new TypeReference<LinkedHashMap<String, Double>>() {}))
                .payload(fromJson(record.getString("payload"), new TypeReference<LinkedHashMap<String, Object>>() {}))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize reading field", e);
            return "{}";
        }
    }

    private <T extends Map<String, ?>> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isEmpty()) {
            return objectMapper.convertValue(Collections.emptyMap(), type);
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize reading field", e);
            return objectMapper.convertValue(Collections.emptyMap(), type);
        }
    }
}
