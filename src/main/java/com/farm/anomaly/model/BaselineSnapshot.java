package com.farm.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Rolling baseline held for one device parameter")
public class BaselineSnapshot {

    @Schema(description = "Parameter name", example = "N")
    private String parameter;

    @Schema(description = "Window values, oldest first", example = "[50.0, 51.0, 49.0]")
    private List<Double> window;

    @Schema(description = "Most recently recorded value", example = "49.0")
    private Double previous;
}
