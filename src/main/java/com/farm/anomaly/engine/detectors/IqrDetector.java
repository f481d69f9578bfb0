package com.farm.anomaly.engine.detectors;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.engine.AnomalyDetector;
import com.farm.anomaly.engine.DetectionInput;
import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Interquartile range outlier detection.
 *
 * Quartiles are taken by index, without interpolation: q1 = sorted[n / 4],
 * q3 = sorted[3n / 4]. Normal band is [q1 - m * iqr, q3 + m * iqr] where
 * m = detection.iqr-multiplier. Values strictly outside the band are flagged.
 */
@Component
public class IqrDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IqrDetector.class);

    static final int MIN_SAMPLES = 4;

    private final DetectionConfig config;

    public IqrDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.IQR;
    }

    @Override
    public Optional<Finding> detect(DetectionInput input) {
        List<Double> window = input.getWindow();
        if (window.size() < MIN_SAMPLES) {
            return Optional.empty();
        }

        List<Double> sorted = new ArrayList<>(window);
        Collections.sort(sorted);
        int n = sorted.size();

        double q1 = sorted.get(n / 4);
        double q3 = sorted.get((3 * n) / 4);
        double iqr = q3 - q1;

        double multiplier = config.getIqrMultiplier();
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;

        double value = input.getValue();
        if (value >= lowerBound && value <= upperBound) {
            return Optional.empty();
        }

        log.debug("IQR anomaly on {}: value={} outside [{}, {}]",
                input.getParameter(), value, lowerBound, upperBound);
        return Optional.of(Finding.iqr(lowerBound, upperBound));
    }
}
