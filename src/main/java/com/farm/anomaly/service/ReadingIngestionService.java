package com.farm.anomaly.service;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.config.MetricsConfig;
import com.farm.anomaly.engine.DetectorEngine;
import com.farm.anomaly.engine.ForwardingPolicy;
import com.farm.anomaly.engine.baseline.BaselineStore;
import com.farm.anomaly.model.AnomalyReport;
import com.farm.anomaly.model.ReadingAnalysis;
import com.farm.anomaly.model.SensorReading;
import com.farm.anomaly.model.Sensitivity;
import com.farm.anomaly.model.Severity;
import com.farm.anomaly.repository.AnalysisRepository;
import com.farm.anomaly.repository.ReadingRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main orchestrator for reading ingestion.
 *
 * Flow, per parameter and under that parameter's baseline lock:
 * 1. Read the window and previous value (or take the reading's override)
 * 2. Run all detection methods via the DetectorEngine
 * 3. Decide escalation via the ForwardingPolicy
 * 4. Record the value into the baseline
 *
 * Parameters beyond the device's parameter cap are skipped.
 *
 * Then, with no lock held:
 * 5. Decide forwarding: any parameter escalated OR any parameter has a finding
 * 6. Attach a soil assessment to forwarded readings carrying N, P, K and ph
 * 7. Archive the reading and its analysis (best-effort)
 * 8. Hand forwarded readings to the alert forwarder and the SMS notifier
 */
@Service
public class ReadingIngestionService {

    private static final Logger log = LoggerFactory.getLogger(ReadingIngestionService.class);

    public static final String ANALYSIS_FIELD = "anomaly_analysis";

    private final BaselineStore baselineStore;
    private final DetectorEngine detectorEngine;
    private final ForwardingPolicy forwardingPolicy;
    private final DetectionConfig detectionConfig;
    private final ReadingRepository readingRepository;
    private final AnalysisRepository analysisRepository;
    private final AlertForwarder alertForwarder;
    private final TwilioNotificationService notificationService;
    private final RegionalSoilService regionalSoilService;
    private final MetricsConfig metricsConfig;

    public ReadingIngestionService(BaselineStore baselineStore,
                                   DetectorEngine detectorEngine,
                                   ForwardingPolicy forwardingPolicy,
                                   DetectionConfig detectionConfig,
                                   ReadingRepository readingRepository,
                                   AnalysisRepository analysisRepository,
                                   AlertForwarder alertForwarder,
                                   TwilioNotificationService notificationService,
                                   RegionalSoilService regionalSoilService,
                                   MetricsConfig metricsConfig) {
        this.baselineStore = baselineStore;
        this.detectorEngine = detectorEngine;
        this.forwardingPolicy = forwardingPolicy;
        this.detectionConfig = detectionConfig;
        this.readingRepository = readingRepository;
        this.analysisRepository = analysisRepository;
        this.alertForwarder = alertForwarder;
        this.notificationService = notificationService;
        this.regionalSoilService = regionalSoilService;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run detection over every parameter of a reading and decide whether to forward it.
     * This is the main entry point called by the REST controller.
     */
    @Observed(name = "reading.ingest", contextualName = "ingest-reading")
    public ReadingAnalysis ingest(SensorReading reading) {
        Sensitivity sensitivity = detectionConfig.resolveSensitivity();
        Map<String, AnomalyReport> reports = new LinkedHashMap<>();
        boolean anyEscalated = false;
        boolean anyFinding = false;
        Severity overall = Severity.NORMAL;

        for (Map.Entry<String, Double> entry : reading.getParameters().entrySet()) {
            String parameter = entry.getKey();
            if (!baselineStore.admit(reading.getDeviceId(), parameter)) {
                metricsConfig.recordRejectedParameter("device_limit");
                continue;
            }
            ParameterOutcome outcome = evaluateParameter(reading.getDeviceId(), parameter, entry.getValue(),
                    reading.getTimestamp(), reading.getPreviousOverrides().get(parameter), sensitivity);

            AnomalyReport report = outcome.report;
            reports.put(parameter, report);
            anyEscalated |= outcome.escalated;
            anyFinding |= !forwardingPolicy.isNormal(report);
            if (report.getSeverity().compareTo(overall) > 0) {
                overall = report.getSeverity();
            }
        }

        // Any finding forwards the reading, whatever the sensitivity tier
        boolean forward = anyEscalated || anyFinding;

        ReadingAnalysis analysis = ReadingAnalysis.builder()
                .readingId(reading.getReadingId())
                .deviceId(reading.getDeviceId())
                .timestamp(reading.getTimestamp())
                .reports(reports)
                .overallSeverity(overall)
                .forwarded(forward)
                .sensitivity(sensitivity)
                .build();

        if (forward) {
            regionalSoilService.assess(reading).ifPresent(assessment -> {
                analysis.setSoilAssessment(assessment);
                metricsConfig.recordSoilAssessment(assessment.getRegion());
            });
        }

        metricsConfig.recordReading(forward, overall);
        metricsConfig.updateTrackedBaselineKeys(baselineStore.size());

        archive(reading, analysis);

        if (forward) {
            log.warn("Anomaly detected for device={}: severity={}, parameters={}",
                    reading.getDeviceId(), overall, flaggedParameters(reports));
            alertForwarder.forward(reading.getDeviceId(), buildAlertPayload(reading, reports));
            notificationService.notifyIfSevere(analysis);
        } else {
            log.debug("Reading from device={} is normal across {} parameters",
                    reading.getDeviceId(), reports.size());
        }

        return analysis;
    }

    /**
     * Evaluate a single parameter value: read baseline, detect, record.
     *
     * @param previousOverride compared against instead of the stored previous value when not null
     */
    public AnomalyReport evaluateParameter(String deviceId, String parameter, double value,
                                           long timestamp, Double previousOverride) {
        return evaluateParameter(deviceId, parameter, value, timestamp, previousOverride,
                detectionConfig.resolveSensitivity()).report;
    }

    private ParameterOutcome evaluateParameter(String deviceId, String parameter, double value, long timestamp,
                                               Double previousOverride, Sensitivity sensitivity) {
        return baselineStore.withLock(deviceId, parameter, () -> {
            Double previous = previousOverride != null
                    ? previousOverride
                    : baselineStore.previous(deviceId, parameter).orElse(null);

            AnomalyReport report = detectorEngine.evaluate(value, parameter,
                    baselineStore.window(deviceId, parameter), previous,
                    detectionConfig.boundsFor(parameter), timestamp);

            boolean escalated = forwardingPolicy.shouldEscalate(report.getSeverity(), sensitivity);

            // Record only after evaluation so the value is never compared against itself
            baselineStore.record(deviceId, parameter, value);
            return new ParameterOutcome(report, escalated);
        });
    }

    /**
     * The original input structure plus an "anomaly_analysis" map of parameter to report.
     */
    Map<String, Object> buildAlertPayload(SensorReading reading, Map<String, AnomalyReport> reports) {
        Map<String, Object> payload = new LinkedHashMap<>(reading.getPayload());
        payload.put(ANALYSIS_FIELD, reports);
        return payload;
    }

    private void archive(SensorReading reading, ReadingAnalysis analysis) {
        try {
            readingRepository.save(reading);
            analysisRepository.save(analysis);
            metricsConfig.recordArchiveWrite("success");
        } catch (RuntimeException e) {
            metricsConfig.recordArchiveWrite("error");
            log.error("Failed to archive reading for device={}: {}", reading.getDeviceId(), e.getMessage(), e);
        }
    }

    private String flaggedParameters(Map<String, AnomalyReport> reports) {
        StringBuilder sb = new StringBuilder();
        reports.forEach((parameter, report) -> {
            if (!report.isNormal()) {
                if (sb.length() > 0) sb.append(", ");
                sb.append(parameter).append('=').append(report.getSeverity().getValue());
            }
        });
        return sb.toString();
    }

    private static final class ParameterOutcome {
        private final AnomalyReport report;
        private final boolean escalated;

        private ParameterOutcome(AnomalyReport report, boolean escalated) {
            this.report = report;
            this.escalated = escalated;
        }
    }
}
