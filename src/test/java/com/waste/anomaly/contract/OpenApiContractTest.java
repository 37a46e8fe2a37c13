package com.waste.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.waste.anomaly.config.TestAerospikeConfig;
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
 * Pins the published API surface so consumers notice schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        assertThat(paths).containsKeys(
                "/api/v1/submissions",
                "/api/v1/submissions/{submissionId}",
                "/api/v1/submissions/subject/{subjectId}",
                "/api/v1/detect",
                "/api/v1/oversight/dashboard",
                "/api/v1/oversight/anomalies/today",
                "/api/v1/oversight/anomalies/recent",
                "/api/v1/oversight/subjects/high-risk",
                "/api/v1/oversight/reports/{reportKey}");
    }

    @Test
    void openApiSpec_detectionSchemasUseWireNames() {
        DocumentContext json = apiDocs();

        Map<String, Object> request = json.read("$.components.schemas.DetectionRequest.properties");
        assertThat(request).containsKeys("subjectId", "currentQuantity", "history");

        Map<String, Object> response = json.read("$.components.schemas.DetectionResponse.properties");
        assertThat(response).containsKeys("subjectId", "isAnomaly", "zScore", "mean", "stdDev");
    }

    @Test
    void openApiSpec_submissionResponseHidesDetection() {
        Map<String, Object> props = apiDocs().read("$.components.schemas.SubmissionResponse.properties");

        assertThat(props).containsKeys("submissionId", "subjectId", "quantity", "createdAt", "status");
        assertThat(props).doesNotContainKeys("zScore", "isAnomaly", "mean", "stdDev");
    }

    @Test
    void openApiSpec_anomalyRecordSchema() {
        Map<String, Object> props = apiDocs().read("$.components.schemas.AnomalyRecord.properties");

        assertThat(props).containsKeys("recordId", "subjectId", "submissionId", "quantity",
                "mean", "stdDev", "zScore", "flagged", "createdAt");
    }
}
