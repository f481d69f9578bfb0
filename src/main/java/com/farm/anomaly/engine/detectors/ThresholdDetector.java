package com.farm.anomaly.engine.detectors;

import com.farm.anomaly.engine.AnomalyDetector;
import com.farm.anomaly.engine.DetectionInput;
import com.farm.anomaly.model.CriticalBound;
import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Finding;
import com.farm.anomaly.model.ThresholdStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags values outside the parameter's static critical range. The only
 * method that does not depend on history.
 */
@Component
public class ThresholdDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ThresholdDetector.class);

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.THRESHOLD;
    }

    @Override
    public Optional<Finding> detect(DetectionInput input) {
        CriticalBound bounds = input.getBounds();
        if (bounds == null || !bounds.isComplete()) {
            return Optional.empty();
        }

        double value = input.getValue();
        if (value < bounds.getLow()) {
            log.debug("Threshold anomaly on {}: value {} below critical low {}",
                    input.getParameter(), value, bounds.getLow());
            return Optional.of(Finding.threshold(ThresholdStatus.BELOW_CRITICAL));
        }
        if (value > bounds.getHigh()) {
            log.debug("Threshold anomaly on {}: value {} above critical high {}",
                    input.getParameter(), value, bounds.getHigh());
            return Optional.of(Finding.threshold(ThresholdStatus.ABOVE_CRITICAL));
        }
        return Optional.empty();
    }
}
