package com.farm.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Locale;

/**
 * A positive verdict from one detection method. Only the field that belongs
 * to the method is populated: {@code value} for z-score, {@code bounds} for
 * IQR, {@code changeRate} for change rate and {@code status} for threshold.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Verdict of a single detection method")
public class Finding {

    @Schema(description = "Detection method", example = "zscore")
    DetectionMethod method;

    @Schema(description = "Z-score magnitude (zscore method only)", example = "58.40")
    Double value;

    @Schema(description = "Computed [lower, upper] bounds (iqr method only)", example = "[46.0, 54.0]")
    List<Double> bounds;

    @JsonProperty("change_rate")
    @Schema(description = "Relative change from the previous value (change_rate method only)", example = "1.4")
    Double changeRate;

    @Schema(description = "Critical bound violated (threshold method only)", example = "below_critical")
    ThresholdStatus status;

    @Schema(description = "Human-readable description", example = "Z-score: 58.40")
    String description;

    public static Finding zscore(double zscore) {
        return Finding.builder()
                .method(DetectionMethod.ZSCORE)
                .value(zscore)
                .description(String.format(Locale.ROOT, "Z-score: %.2f", zscore))
                .build();
    }

    public static Finding iqr(double lowerBound, double upperBound) {
        return Finding.builder()
                .method(DetectionMethod.IQR)
                .bounds(List.of(lowerBound, upperBound))
                .description(String.format(Locale.ROOT, "IQR: outside [%.2f, %.2f]", lowerBound, upperBound))
                .build();
    }

    public static Finding changeRate(double rate) {
        return Finding.builder()
                .method(DetectionMethod.CHANGE_RATE)
                .changeRate(rate)
                .description(String.format(Locale.ROOT, "Change rate: %.2f%%", rate * 100.0))
                .build();
    }

    public static Finding threshold(ThresholdStatus status) {
        return Finding.builder()
                .method(DetectionMethod.THRESHOLD)
                .status(status)
                .description("Threshold violation: " + status.getValue())
                .build();
    }
}
