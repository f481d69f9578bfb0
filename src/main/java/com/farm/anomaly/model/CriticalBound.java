package com.farm.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Static critical range for one parameter")
public class CriticalBound {

    @Schema(description = "Values below this are critical", example = "10.0")
    private Double low;

    @Schema(description = "Values above this are critical", example = "150.0")
    private Double high;

    public boolean isComplete() {
        return low != null && high != null;
    }
}
