package com.farm.anomaly.service;

import com.farm.anomaly.config.AlertingConfig;
import com.farm.anomaly.config.MetricsConfig;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Delivers enriched readings to the alerting endpoint. One POST per reading,
 * at most once: a failed delivery is logged and counted, never retried.
 */
@Service
public class AlertForwarder {

    private static final Logger log = LoggerFactory.getLogger(AlertForwarder.class);

    private final AlertingConfig config;
    private final RestClient restClient;
    private final MetricsConfig metricsConfig;

    public AlertForwarder(AlertingConfig config, RestClient.Builder restClientBuilder, MetricsConfig metricsConfig) {
        this.config = config;
        this.restClient = restClientBuilder.build();
        this.metricsConfig = metricsConfig;
    }

    @Async
    @Observed(name = "alert.forward", contextualName = "forward-alert")
    public void forward(String deviceId, Map<String, Object> enrichedReading) {
        if (!config.isEnabled()) {
            log.debug("Alert forwarding disabled; dropping alert for device={}", deviceId);
            return;
        }

        try {
            restClient.post()
                    .uri(config.getEndpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(enrichedReading)
                    .retrieve()
                    .toBodilessEntity();

            metricsConfig.recordAlertForward("success");
            log.info("Forwarded anomaly alert for device={} to {}", deviceId, config.getEndpoint());
        } catch (RestClientException e) {
            metricsConfig.recordAlertForward("error");
            log.error("Failed to forward anomaly alert for device={}: {}", deviceId, e.getMessage(), e);
        }
    }
}
