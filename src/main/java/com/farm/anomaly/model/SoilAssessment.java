package com.farm.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Soil classification and crop ranking for a forwarded reading, keyed by edge region")
public class SoilAssessment {

    @Schema(description = "Edge region taken from the reading's edge_node field", example = "edge-eu-1")
    private String region;

    @Schema(description = "Reporting device identifier", example = "device_germany")
    private String deviceId;

    @Schema(description = "Reading timestamp in epoch milliseconds", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Soil classification")
    private SoilQuality soil;

    @Schema(description = "Crops ordered from best to worst suited")
    @Builder.Default
    private List<CropSuggestion> crops = new ArrayList<>();
}
