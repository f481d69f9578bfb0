package com.farm.anomaly.engine;

import com.farm.anomaly.config.DetectionConfig;
import com.farm.anomaly.config.MetricsConfig;
import com.farm.anomaly.model.*;
import com.farm.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static com.farm.anomaly.testutil.TestDataFactory.STABLE_WINDOW;
import static com.farm.anomaly.testutil.TestDataFactory.TIMESTAMP;
import static org.assertj.core.api.Assertions.assertThat;

class DetectorEngineTest {

    private static final CriticalBound N_BOUNDS = new CriticalBound(10.0, 150.0);

    private DetectionConfig config;
    private DetectorEngine engine;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.createDetectionConfig();
        registry = new SimpleMeterRegistry();
        engine = TestDataFactory.createDetectorEngine(config, new MetricsConfig(registry));
    }

    @Test
    void evaluate_spikeWithinCriticalRange_flagsStatisticalMethodsOnly() {
        AnomalyReport report = engine.evaluate(120.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod)
                .containsExactly(DetectionMethod.ZSCORE, DetectionMethod.IQR, DetectionMethod.CHANGE_RATE);
        assertThat(report.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.getParameter()).isEqualTo("N");
        assertThat(report.getValue()).isEqualTo(120.0);
        assertThat(report.getTimestamp()).isEqualTo(TIMESTAMP);
    }

    @Test
    void evaluate_dropBelowCriticalLow_flagsAllFourMethods() {
        AnomalyReport report = engine.evaluate(5.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod)
                .containsExactly(DetectionMethod.ZSCORE, DetectionMethod.IQR,
                        DetectionMethod.CHANGE_RATE, DetectionMethod.THRESHOLD);
        assertThat(report.getFindings().get(3).getStatus()).isEqualTo(ThresholdStatus.BELOW_CRITICAL);
        assertThat(report.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void evaluate_ordinaryValue_isNormal() {
        AnomalyReport report = engine.evaluate(50.0, "N", STABLE_WINDOW, 49.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).isEmpty();
        assertThat(report.getSeverity()).isEqualTo(Severity.NORMAL);
        assertThat(report.isNormal()).isTrue();
    }

    @Test
    void evaluate_twoMethodsFlag_isHigh() {
        // z ~4.09, 55 > 54 upper IQR bound, change 10%
        AnomalyReport report = engine.evaluate(55.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod)
                .containsExactly(DetectionMethod.ZSCORE, DetectionMethod.IQR);
        assertThat(report.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void evaluate_oneMethodFlags_isMedium() {
        // z ~3.26 but 54 sits exactly on the upper IQR bound
        AnomalyReport report = engine.evaluate(54.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod)
                .containsExactly(DetectionMethod.ZSCORE);
        assertThat(report.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void evaluate_constantWindowSameValue_isNormal() {
        List<Double> constant = Collections.nCopies(10, 50.0);

        AnomalyReport report = engine.evaluate(50.0, "N", constant, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getSeverity()).isEqualTo(Severity.NORMAL);
    }

    @Test
    void evaluate_constantWindowSmallShift_onlyIqrFlags() {
        List<Double> constant = Collections.nCopies(10, 50.0);

        AnomalyReport report = engine.evaluate(51.0, "N", constant, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod).containsExactly(DetectionMethod.IQR);
    }

    @Test
    void evaluate_emptyHistory_onlyThresholdCanFlag() {
        AnomalyReport report = engine.evaluate(200.0, "N", List.of(), null, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod).containsExactly(DetectionMethod.THRESHOLD);
        assertThat(report.getFindings().get(0).getStatus()).isEqualTo(ThresholdStatus.ABOVE_CRITICAL);
    }

    @Test
    void evaluate_unboundedParameter_neverThresholdFlags() {
        AnomalyReport report = engine.evaluate(-1_000.0, "moisture", List.of(), null, null, TIMESTAMP);

        assertThat(report.isNormal()).isTrue();
    }

    @Test
    void evaluate_shortWindows_neverFlagStatistically() {
        Random random = new Random(42);
        for (int trial = 0; trial < 200; trial++) {
            List<Double> window = new ArrayList<>();
            int size = random.nextInt(4);
            for (int i = 0; i < size; i++) {
                window.add(random.nextDouble() * 100);
            }
            double value = (random.nextDouble() - 0.5) * 1e6;

            AnomalyReport report = engine.evaluate(value, "N", window, null, null, TIMESTAMP);

            assertThat(report.getFindings()).extracting(Finding::getMethod)
                    .doesNotContain(DetectionMethod.IQR);
            if (size < 2) {
                assertThat(report.getFindings()).extracting(Finding::getMethod)
                        .doesNotContain(DetectionMethod.ZSCORE);
            }
        }
    }

    @Test
    void evaluate_severityAlwaysMatchesFindingCount() {
        Random random = new Random(7);
        for (int trial = 0; trial < 200; trial++) {
            List<Double> window = new ArrayList<>();
            int size = random.nextInt(25);
            for (int i = 0; i < size; i++) {
                window.add(40 + random.nextDouble() * 20);
            }
            Double previous = random.nextBoolean() ? 40 + random.nextDouble() * 20 : null;
            double value = random.nextDouble() * 200;

            AnomalyReport report = engine.evaluate(value, "N", window, previous, N_BOUNDS, TIMESTAMP);

            assertThat(report.getSeverity())
                    .isEqualTo(Severity.fromFindingCount(report.getFindings().size()));
        }
    }

    @Test
    void evaluate_doesNotModifyCallerWindow() {
        List<Double> window = new ArrayList<>(STABLE_WINDOW);

        engine.evaluate(120.0, "N", window, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(window).isEqualTo(STABLE_WINDOW);
    }

    @Test
    void evaluate_failingDetector_abstainsWithoutBlockingOthers() {
        AnomalyDetector broken = new AnomalyDetector() {
            @Override
            public DetectionMethod getMethod() {
                return DetectionMethod.ZSCORE;
            }

            @Override
            public Optional<Finding> detect(DetectionInput input) {
                throw new IllegalStateException("boom");
            }
        };
        DetectorEngine partial = new DetectorEngine(
                List.of(broken, new com.farm.anomaly.engine.detectors.ThresholdDetector()),
                Tracer.NOOP, new MetricsConfig(new SimpleMeterRegistry()));

        AnomalyReport report = partial.evaluate(5.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(report.getFindings()).extracting(Finding::getMethod).containsExactly(DetectionMethod.THRESHOLD);
        assertThat(report.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void evaluate_countsFindingsPerMethod() {
        engine.evaluate(120.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);
        engine.evaluate(5.0, "N", STABLE_WINDOW, 50.0, N_BOUNDS, TIMESTAMP);

        assertThat(registry.get("detection.finding.count").tag("method", "zscore").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("detection.finding.count").tag("method", "threshold").counter().count()).isEqualTo(1.0);
    }
}
