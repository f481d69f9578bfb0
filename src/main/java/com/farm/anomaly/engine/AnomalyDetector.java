package com.farm.anomaly.engine;

import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Finding;

import java.util.Optional;

/**
 * A single, side-effect-free detection method.
 * Each implementation handles one {@link DetectionMethod}.
 */
public interface AnomalyDetector {

    /**
     * The method this detector implements.
     */
    DetectionMethod getMethod();

    /**
     * Evaluate one value against its baseline snapshot.
     *
     * @param input value, window, previous value and critical bounds
     * @return a finding when the value is anomalous under this method; empty when
     *         it is not, or when the method cannot be applied to this input
     */
    Optional<Finding> detect(DetectionInput input);
}
