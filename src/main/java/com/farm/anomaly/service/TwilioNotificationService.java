package com.farm.anomaly.service;

import com.farm.anomaly.config.MetricsConfig;
import com.farm.anomaly.config.TwilioNotificationConfig;
import com.farm.anomaly.model.AnomalyReport;
import com.farm.anomaly.model.Finding;
import com.farm.anomaly.model.ReadingAnalysis;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Pages the farm operator when a forwarded reading reaches {@code twilio.min-severity}.
 */
@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isConfigured()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Soil alert paging enabled via {} for severity >= {}",
                    config.getChannel(), config.getMinSeverity().getValue());
        } else if (config.isEnabled()) {
            log.warn("twilio.enabled is set but credentials or numbers are missing; soil alert paging is off");
        } else {
            log.info("Soil alert paging is DISABLED.");
        }
    }

    boolean shouldNotify(ReadingAnalysis analysis) {
        return config.isConfigured()
                && analysis.isForwarded()
                && analysis.getOverallSeverity().compareTo(config.getMinSeverity()) >= 0;
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-notification")
    public void notifyIfSevere(ReadingAnalysis analysis) {
        if (!shouldNotify(analysis)) {
            return;
        }

        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    buildMessageBody(analysis)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Soil alert sent for device={}, sid={}", analysis.getDeviceId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send soil alert for device={}: {}",
                    analysis.getDeviceId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(ReadingAnalysis analysis) {
        String flagged = analysis.getReports().values().stream()
                .filter(r -> r.getSeverity().compareTo(config.getMinSeverity()) >= 0)
                .sorted(Comparator.comparing(AnomalyReport::getSeverity).reversed())
                .limit(config.getMaxParametersInMessage())
                .map(r -> String.format(Locale.ROOT, "%s=%.2f (%s)",
                        r.getParameter(), r.getValue(), r.getSeverity().getValue()))
                .collect(Collectors.joining(", "));

        String topFinding = analysis.getReports().values().stream()
                .max(Comparator.comparingInt((AnomalyReport r) -> r.getFindings().size()))
                .flatMap(r -> r.getFindings().stream().findFirst())
                .map(Finding::getDescription)
                .orElse("N/A");

        StringBuilder body = new StringBuilder()
                .append(config.getMessagePrefix()).append(' ')
                .append(analysis.getOverallSeverity().getValue()).append(" soil reading\n")
                .append("Device: ").append(analysis.getDeviceId()).append('\n')
                .append("Parameters: ").append(flagged).append('\n')
                .append("Top finding: ").append(topFinding);
        if (analysis.getSoilAssessment() != null) {
            body.append('\n').append("Region: ").append(analysis.getSoilAssessment().getRegion());
        }
        return body.toString();
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
