package com.farm.anomaly.engine;

import com.farm.anomaly.model.CriticalBound;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable snapshot a detector evaluates: the new value plus the baseline
 * state as it was before this value is recorded.
 */
@Value
@Builder
public class DetectionInput {

    double value;

    String parameter;

    // Historical values, oldest first. Never includes the value under evaluation.
    @Builder.Default
    List<Double> window = List.of();

    // Last recorded value, or null when the pair has no history yet
    Double previous;

    // Static critical range for the parameter, or null when none is configured
    CriticalBound bounds;
}
