package com.farm.anomaly.contract;

import com.farm.anomaly.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published API document against accidental path or schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/readings/ingest");
        assertThat(paths).containsKey("/api/v1/readings/device/{deviceId}");
        assertThat(paths).containsKey("/api/v1/analysis/device/{deviceId}");
        assertThat(paths).containsKey("/api/v1/baselines");
        assertThat(paths).containsKey("/api/v1/baselines/{deviceId}");
        assertThat(paths).containsKey("/api/v1/config/detection");
        assertThat(paths).containsKey("/api/v1/config/aerospike");
        assertThat(paths).containsKey("/api/v1/soil/regions");
        assertThat(paths).containsKey("/api/v1/soil/regions/{region}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("ReadingAnalysis");
        assertThat(schemas).containsKey("AnomalyReport");
        assertThat(schemas).containsKey("Finding");
        assertThat(schemas).containsKey("SensorReading");
        assertThat(schemas).containsKey("BaselineSnapshot");
        assertThat(schemas).containsKey("SoilAssessment");
        assertThat(schemas).containsKey("SoilQuality");
        assertThat(schemas).containsKey("CropSuggestion");
    }

    @Test
    void openApiSpec_reportSchema_usesWireFieldNames() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));

        Map<String, Object> reportProps = json.read("$.components.schemas.AnomalyReport.properties");
        assertThat(reportProps).containsKey("parameter");
        assertThat(reportProps).containsKey("current_value");
        assertThat(reportProps).containsKey("anomalies_detected");
        assertThat(reportProps).containsKey("severity");

        Map<String, Object> findingProps = json.read("$.components.schemas.Finding.properties");
        assertThat(findingProps).containsKey("method");
        assertThat(findingProps).containsKey("change_rate");
        assertThat(findingProps).containsKey("description");
    }
}
