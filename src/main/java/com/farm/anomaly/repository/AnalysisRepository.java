package com.farm.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.farm.anomaly.config.AerospikeConfig;
import com.farm.anomaly.model.AnomalyReport;
import com.farm.anomaly.model.ReadingAnalysis;
import com.farm.anomaly.model.Sensitivity;
import com.farm.anomaly.model.Severity;
import com.farm.anomaly.model.SoilAssessment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Analysis archive, keyed by the id of the analysed reading.
 */
@Repository
public class AnalysisRepository {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AnalysisRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              ObjectMapper objectMapper) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = objectMapper;
    }

    public void save(ReadingAnalysis analysis) {
        if (analysis.getReadingId() == null) {
            analysis.setReadingId(UUID.randomUUID().toString());
        }
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSES, analysis.getReadingId());

        client.put(writePolicy, key,
                new Bin("readingId", analysis.getReadingId()),
                new Bin("deviceId", analysis.getDeviceId()),
                new Bin("timestamp", analysis.getTimestamp()),
                new Bin("severity", analysis.getOverallSeverity().name()),
                new Bin("forwarded", analysis.isForwarded()),
                new Bin("sensitivity", analysis.getSensitivity().name()),
                new Bin("reports", serializeReports(analysis.getReports())),
                new Bin("soil", serializeSoil(analysis.getSoilAssessment())));
    }

    public List<ReadingAnalysis> findByDevice(String deviceId, int limit) {
        List<ReadingAnalysis> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANALYSES,
                (key, record) -> {
                    if (deviceId.equals(record.getString("deviceId"))) {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    }
                });

        results.sort(Comparator.comparingLong(ReadingAnalysis::getTimestamp).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private ReadingAnalysis mapRecord(Record record) {
        return ReadingAnalysis.builder()
                .readingId(record.getString("readingId"))
                .deviceId(record.getString("deviceId"))
                .timestamp(record.getLong("timestamp"))
                .overallSeverity(Severity.valueOf(record.getString("severity")))
                .forwarded(record.getBoolean("forwarded"))
                .sensitivity(Sensitivity.valueOf(record.getString("sensitivity")))
                .reports(deserializeReports(record.getString("reports")))
                .soilAssessment(deserializeSoil(record.getString("soil")))
                .build();
    }

    private String serializeReports(Map<String, AnomalyReport> reports) {
        try {
            return objectMapper.writeValueAsString(reports);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize anomaly reports", e);
            return "{}";
        }
    }

    private String serializeSoil(SoilAssessment assessment) {
        if (assessment == null) return null;
        try {
            return objectMapper.writeValueAsString(assessment);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize soil assessment", e);
            return null;
        }
    }

    private SoilAssessment deserializeSoil(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, SoilAssessment.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize soil assessment", e);
            return null;
        }
    }

    private Map<String, AnomalyReport> deserializeReports(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, AnomalyReport>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize anomaly reports", e);
            return new LinkedHashMap<>();
        }
    }
}
