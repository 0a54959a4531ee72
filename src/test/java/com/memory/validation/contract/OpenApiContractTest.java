package com.memory.validation.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static com.memory.validation.testutil.TestDataFactory.createRecord;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test over the published OpenAPI document, plus one request through the fully wired context.
 * Guards consumers of the review UI against accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
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
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Validation endpoints
        assertThat(paths).containsKey("/api/v1/validation/evaluate");
        assertThat(paths).containsKey("/api/v1/validation/batch");
        assertThat(paths).containsKey("/api/v1/validation/review-queue");

        // Threshold configuration endpoints
        assertThat(paths).containsKey("/api/v1/config/thresholds");
        assertThat(paths).containsKey("/api/v1/config/thresholds/rollback");
        assertThat(paths).containsKey("/api/v1/config/thresholds/history");

        // Feedback and quality endpoints
        assertThat(paths).containsKey("/api/v1/feedback");
        assertThat(paths).containsKey("/api/v1/quality/metrics");
        assertThat(paths).containsKey("/api/v1/quality/alerts");
        assertThat(paths).containsKey("/api/v1/quality/calibration/propose");
        assertThat(paths).containsKey("/api/v1/quality/calibration/run");

        // Analytics and sampling endpoints
        assertThat(paths).containsKey("/api/v1/analytics/report");
        assertThat(paths).containsKey("/api/v1/analytics/effectiveness");
        assertThat(paths).containsKey("/api/v1/analytics/sampling-effectiveness");
        assertThat(paths).containsKey("/api/v1/analytics/sample");
        assertThat(paths).containsKey("/api/v1/analytics/sample/strategy");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("MemoryRecord");
        assertThat(schemas).containsKey("BatchRequest");
        assertThat(schemas).containsKey("ValidationFeedback");
        assertThat(schemas).containsKey("ReviewQueueEntry");
        assertThat(schemas).containsKey("ValidationDecision");
        assertThat(schemas).containsKey("QualityMetrics");
        assertThat(schemas).containsKey("CalibrationAdjustment");
        assertThat(schemas).containsKey("ThresholdVersion");
        assertThat(schemas).containsKey("SamplingRequest");
        assertThat(schemas).containsKey("AnalyticsReport");
    }

    @Test
    void openApiSpec_recordAndDecisionSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> recordProps = json.read("$.components.schemas.MemoryRecord.properties");
        assertThat(recordProps).containsKey("id");
        assertThat(recordProps).containsKey("extractionConfidence");
        assertThat(recordProps).containsKey("emotionalCoherence");
        assertThat(recordProps).containsKey("relationshipAccuracy");
        assertThat(recordProps).containsKey("contextQuality");

        Map<String, Object> decisionProps = json.read("$.components.schemas.ValidationDecision.properties");
        assertThat(decisionProps).containsKey("outcome");
        assertThat(decisionProps).containsKey("confidence");
        assertThat(decisionProps).containsKey("priority");
        assertThat(decisionProps).containsKey("reasoning");
        assertThat(decisionProps).containsKey("thresholdVersion");
    }

    @Test
    void evaluate_wiredContext_returnsDecision() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/validation/evaluate",
                createRecord("MEM-CONTRACT", 0.9, 0.9, 0.9, 0.9), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.decision.outcome", String.class)).isEqualTo("AUTO_APPROVE");
        assertThat(json.read("$.decision.recordId", String.class)).isEqualTo("MEM-CONTRACT");
    }

    @Test
    void actuator_exposesOnlyConfiguredEndpoints() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> links = JsonPath.parse(response.getBody()).read("$._links");
        assertThat(links).containsKeys("health", "info", "metrics");
        assertThat(links).doesNotContainKey("prometheus");
    }

    @Test
    void batchThenReport_wiredContext_batchShowsInTrends() {
        restTemplate.postForEntity("/api/v1/validation/batch",
                Map.of("records", List.of(createRecord("MEM-TREND", 0.9, 0.9, 0.9, 0.9))), String.class);

        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/analytics/report", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.performance.batchesRecorded", Integer.class)).isGreaterThanOrEqualTo(1);
    }
}
