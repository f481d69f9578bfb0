package com.farm.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI sensorAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sensor Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Streaming anomaly detection for soil sensor readings.\n\n" +
                                "**Ingestion Pipeline:**\n" +
                                "1. Receive a reading via `POST /readings/ingest`\n" +
                                "2. For each numeric parameter, load the device's rolling baseline (last 20 values)\n" +
                                "3. Run the four detection methods against the prior baseline\n" +
                                "4. Classify severity by finding count: **normal** (0), **medium** (1), **high** (2), **critical** (3+)\n" +
                                "5. Record the value into the baseline\n" +
                                "6. Forward the enriched reading to the alerting endpoint when any parameter escalates " +
                                "under the configured sensitivity or produced any finding\n\n" +
                                "**Detection Methods:**\n" +
                                "- `zscore`: distance from the window mean in sample standard deviations\n" +
                                "- `iqr`: outside the interquartile band widened by the IQR multiplier\n" +
                                "- `change_rate`: relative jump from the previous value\n" +
                                "- `threshold`: outside the parameter's static critical range")
                        .contact(new Contact().name("Soil Monitoring Team")));
    }
}
