package com.farm.anomaly.engine.detectors;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.engine.AnomalyDetector;
import com.farm.anomaly.engine.DetectionInput;
import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Detects sudden jumps relative to the previous value.
 *
 * Logic: rate = |(value - previous) / previous|. Flags when
 * rate >= detection.change-rate-threshold. Needs a previous value that is
 * present and non-zero.
 *
 * Example: previous 50, value 120 gives rate 1.4 (140%).
 */
@Component
public class ChangeRateDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeRateDetector.class);

    private final DetectionConfig config;

    public ChangeRateDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.CHANGE_RATE;
    }

    @Override
    public Optional<Finding> detect(DetectionInput input) {
        Double previous = input.getPrevious();
        if (previous == null || previous == 0.0) {
            return Optional.empty();
        }

        double rate = Math.abs((input.getValue() - previous) / previous);
        if (rate < config.getChangeRateThreshold()) {
            return Optional.empty();
        }

        log.debug("Change rate anomaly on {}: previous={}, value={}, rate={}",
                input.getParameter(), previous, input.getValue(), rate);
        return Optional.of(Finding.changeRate(rate));
    }
}
