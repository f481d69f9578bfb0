package com.farm.anomaly.engine;

import com.farm.anomaly.config.MetricsConfig;
import com.farm.anomaly.model.AnomalyReport;
import com.farm.anomaly.model.CriticalBound;
import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Finding;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every detection method against one value and folds the findings into
 * an {@link AnomalyReport}. Uses the Strategy pattern: each DetectionMethod is
 * handled by a registered AnomalyDetector.
 *
 * All methods run on every call, in {@link DetectionMethod} declaration order,
 * so findings are always ordered zscore, iqr, change_rate, threshold.
 */
@Component
public class DetectorEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectorEngine.class);

    private final Map<DetectionMethod, AnomalyDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectorEngine(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(DetectionMethod.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (AnomalyDetector detector : detectors) {
            detectorMap.put(detector.getMethod(), detector);
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getMethod(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate one value against its baseline.
     *
     * @param value     the value under evaluation
     * @param parameter parameter name
     * @param window    historical values, oldest first; not modified
     * @param previous  last recorded value, or null
     * @param bounds    static critical range, or null
     * @param timestamp reading timestamp carried into the report
     * @return report with findings in method order and count-derived severity
     */
    public AnomalyReport evaluate(double value, String parameter, List<Double> window,
                                  Double previous, CriticalBound bounds, long timestamp) {
        DetectionInput input = DetectionInput.builder()
                .value(value)
                .parameter(parameter)
                .window(List.copyOf(window))
                .previous(previous)
                .bounds(bounds)
                .build();

        List<Finding> findings = new ArrayList<>();

        for (DetectionMethod method : DetectionMethod.values()) {
            AnomalyDetector detector = detectorMap.get(method);
            if (detector == null) {
                log.warn("No detector registered for method: {}", method);
                continue;
            }

            Span span = tracer.nextSpan()
                    .name("detect." + method.getValue())
                    .tag("detection.method", method.getValue())
                    .tag("detection.parameter", parameter)
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Optional<Finding> finding = detector.detect(input);
                span.tag("detection.flagged", String.valueOf(finding.isPresent()));

                if (finding.isPresent()) {
                    findings.add(finding.get());
                    metricsConfig.recordFinding(method);
                }
            } catch (RuntimeException e) {
                span.error(e);
                log.error("Error running {} detection for parameter {}: {}",
                        method.getValue(), parameter, e.getMessage(), e);
                // One failing method abstains; the others still run
            } finally {
                span.end();
            }
        }

        return new AnomalyReport(parameter, value, timestamp, findings);
    }
}
