package com.farm.anomaly.controller;

import com.farm.anomaly.model.SoilAssessment;
import com.farm.anomaly.service.RegionalSoilService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/soil")
@Tag(name = "Soil", description = "Soil classification and crop ranking of forwarded readings, per edge region")
public class SoilController {

    private final RegionalSoilService regionalSoilService;

    public SoilController(RegionalSoilService regionalSoilService) {
        this.regionalSoilService = regionalSoilService;
    }

    @Operation(summary = "List regions with soil assessments")
    @GetMapping("/regions")
    public ResponseEntity<Set<String>> listRegions() {
        return ResponseEntity.ok(regionalSoilService.regions());
    }

    @Operation(summary = "Latest soil assessment per device in a region")
    @GetMapping("/regions/{region}")
    public ResponseEntity<List<SoilAssessment>> getRegion(
            @Parameter(description = "Edge region (the reading's edge_node)", example = "edge-eu-1")
            @PathVariable String region) {
        List<SoilAssessment> assessments = regionalSoilService.latestForRegion(region);
        if (assessments.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(assessments);
    }
}
