package com.farm.anomaly.config;

import com.farm.anomaly.model.DetectionMethod;
import com.farm.anomaly.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger trackedBaselineKeys;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.trackedBaselineKeys = registry.gauge("baseline.tracked.keys", new AtomicInteger(0));
    }

    public void recordReading(boolean forwarded, Severity overallSeverity) {
        Counter.builder("reading.ingested.count")
                .tag("forwarded", String.valueOf(forwarded))
                .register(registry)
                .increment();

        Counter.builder("reading.severity.count")
                .tag("severity", overallSeverity.getValue())
                .register(registry)
                .increment();
    }

    public void recordRejectedReading(String field) {
        Counter.builder("reading.rejected.count")
                .tag("field", field)
                .register(registry)
                .increment();
    }

    public void recordRejectedParameter(String reason) {
        Counter.builder("parameter.rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordSoilAssessment(String region) {
        Counter.builder("soil.assessment.count")
                .tag("region", region)
                .register(registry)
                .increment();
    }

    public void recordFinding(DetectionMethod method) {
        Counter.builder("detection.finding.count")
                .tag("method", method.getValue())
                .register(registry)
                .increment();
    }

    public void recordAlertForward(String status) {
        Counter.builder("alert.forward.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordArchiveWrite(String status) {
        Counter.builder("archive.write.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateTrackedBaselineKeys(int count) {
        trackedBaselineKeys.set(count);
    }
}
