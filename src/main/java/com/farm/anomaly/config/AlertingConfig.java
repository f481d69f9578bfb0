package com.farm.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "alerting")
public class AlertingConfig {

    private boolean enabled = true;

    // Endpoint that receives enriched readings, one POST per forwarded reading
    private String endpoint = "http://localhost:8080/alert";
}
