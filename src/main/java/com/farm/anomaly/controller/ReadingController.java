package com.farm.anomaly.controller;

import com.farm.anomaly.config.MetricsConfig;
import com.farm.anomaly.model.ReadingAnalysis;
import com.farm.anomaly.model.SensorReading;
import com.farm.anomaly.repository.ReadingRepository;
import com.farm.anomaly.service.MalformedReadingException;
import com.farm.anomaly.service.ReadingIngestionService;
import com.farm.anomaly.service.ReadingParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/readings")
@Tag(name = "Readings", description = "Ingest sensor readings for anomaly detection and query the raw reading archive")
public class ReadingController {

    private static final Logger log = LoggerFactory.getLogger(ReadingController.class);

    private final ReadingIngestionService ingestionService;
    private final ReadingParser readingParser;
    private final ReadingRepository readingRepository;
    private final MetricsConfig metricsConfig;

    public ReadingController(ReadingIngestionService ingestionService,
                             ReadingParser readingParser,
                             ReadingRepository readingRepository,
                             MetricsConfig metricsConfig) {
        this.ingestionService = ingestionService;
        this.readingParser = readingParser;
        this.readingRepository = readingRepository;
        this.metricsConfig = metricsConfig;
    }

    @Operation(summary = "Ingest a sensor reading",
            description = "Accepts a flat JSON reading ({\"device_id\": ..., \"timestamp\": ..., \"N\": 90, ...}). " +
                    "Every numeric non-metadata field is evaluated against the device's rolling baseline " +
                    "with the zscore, iqr, change_rate and threshold methods. Returns per-parameter reports, " +
                    "the overall severity and whether the reading was forwarded for alerting.")
    @PostMapping("/ingest")
    public ResponseEntity<?> ingest(@RequestBody String body) {
        SensorReading reading;
        try {
            reading = readingParser.parse(body);
        } catch (MalformedReadingException e) {
            metricsConfig.recordRejectedReading(e.getField());
            log.warn("Rejected malformed reading ({}): {}", e.getField(), e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", e.getMessage(),
                    "field", e.getField()
            ));
        }

        ReadingAnalysis analysis = ingestionService.ingest(reading);
        return ResponseEntity.ok(analysis);
    }

    @Operation(summary = "List archived readings by device",
            description = "Retrieves recent raw readings for a device, newest first. Readings expire after the configured TTL.")
    @GetMapping("/device/{deviceId}")
    public ResponseEntity<List<SensorReading>> getReadingsByDevice(
            @Parameter(description = "Device ID", example = "device_germany")
            @PathVariable String deviceId,
            @Parameter(description = "Max number of readings to return", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(readingRepository.findRecentByDevice(deviceId, limit));
    }
}
