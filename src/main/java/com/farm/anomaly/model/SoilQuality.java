package com.farm.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Nutrient levels and pH class derived from one reading")
public class SoilQuality {

    @Schema(description = "Nitrogen level (low < 50 <= medium <= 100 < high)", example = "medium")
    private NutrientLevel nitrogen;

    @Schema(description = "Phosphorus level (low < 30 <= medium <= 60 < high)", example = "medium")
    private NutrientLevel phosphorus;

    @Schema(description = "Potassium level (low < 40 <= medium <= 80 < high)", example = "low")
    private NutrientLevel potassium;

    @Schema(description = "pH class (acidic < 6 <= neutral <= 8 < alkaline)", example = "neutral")
    private PhClass phClass;
}
