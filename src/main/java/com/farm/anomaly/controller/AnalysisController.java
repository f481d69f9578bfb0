package com.farm.anomaly.controller;

import com.farm.anomaly.model.ReadingAnalysis;
import com.farm.anomaly.repository.AnalysisRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Query archived anomaly analyses")
public class AnalysisController {

    private final AnalysisRepository analysisRepository;

    public AnalysisController(AnalysisRepository analysisRepository) {
        this.analysisRepository = analysisRepository;
    }

    @Operation(summary = "List analyses by device",
            description = "Retrieves recent anomaly analyses for a device, newest first.")
    @GetMapping("/device/{deviceId}")
    public ResponseEntity<List<ReadingAnalysis>> getAnalysesByDevice(
            @Parameter(description = "Device ID", example = "device_germany")
            @PathVariable String deviceId,
            @Parameter(description = "Max number of analyses to return", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(analysisRepository.findByDevice(deviceId, limit));
    }
}
