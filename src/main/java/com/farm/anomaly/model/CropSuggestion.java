package com.farm.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A crop ranked by how well the reading's soil suits it")
public class CropSuggestion {

    @Schema(description = "Crop name", example = "wheat")
    private String crop;

    @Schema(description = "Suitability score; 1.0 is a perfect match, may go negative", example = "0.95")
    private double score;
}
