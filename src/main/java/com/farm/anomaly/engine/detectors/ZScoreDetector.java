package com.farm.anomaly.engine.detectors;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.engine.AnomalyDetector;
import com.farm.anomaly.engine.DetectionInput;
import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Statistical outlier detection against the window mean.
 *
 * Logic: zscore = |value - mean| / stddev using the sample standard deviation
 * (n - 1). Flags when zscore >= detection.zscore-threshold.
 *
 * Example: window [50, 51, 49, 52, 50, 48, 51, 49, 50, 51] has mean 50.1 and
 * stddev ~1.20, so a value of 120 scores ~58.4 and is flagged.
 */
@Component
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreDetector.class);

    static final int MIN_SAMPLES = 2;

    private final DetectionConfig config;

    public ZScoreDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public Optional<Finding> detect(DetectionInput input) {
        List<Double> window = input.getWindow();
        if (window.size() < MIN_SAMPLES) {
            return Optional.empty();
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0.0;
        for (double v : window) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        // Identical samples have no spread; rounding in the mean must not fake one
        if (min == max) {
            return Optional.empty();
        }

        double mean = sum / window.size();
        double squares = 0.0;
        for (double v : window) {
            squares += (v - mean) * (v - mean);
        }
        double stddev = Math.sqrt(squares / (window.size() - 1));
        if (stddev == 0.0) {
            return Optional.empty();
        }

        double zscore = Math.abs(input.getValue() - mean) / stddev;
        if (zscore < config.getZscoreThreshold()) {
            return Optional.empty();
        }

        log.debug("Z-score anomaly on {}: value={}, mean={}, stddev={}, zscore={}",
                input.getParameter(), input.getValue(), mean, stddev, zscore);
        return Optional.of(Finding.zscore(zscore));
    }
}
