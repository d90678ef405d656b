package com.bank.patterns.contract;

import com.bank.patterns.config.TestAerospikeConfig;
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
 * Guards the published OpenAPI document against accidental path and schema drift.
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
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/predictions/{tenantId}");

        assertThat(paths).containsKey("/api/v1/patterns/{tenantId}");
        assertThat(paths).containsKey("/api/v1/patterns/{tenantId}/stats");
        assertThat(paths).containsKey("/api/v1/patterns/{tenantId}/refresh");
        assertThat(paths).containsKey("/api/v1/patterns/{tenantId}/cache");

        assertThat(paths).containsKey("/api/v1/config/patterns");
    }

    @Test
    void openApiSpec_transactionAndStatsSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> txnProps = json.read("$.components.schemas.Transaction.properties");
        assertThat(txnProps).containsKey("txnId");
        assertThat(txnProps).containsKey("description");
        assertThat(txnProps).containsKey("debitAccount");
        assertThat(txnProps).containsKey("creditAccount");
        assertThat(txnProps).containsKey("referenceCode");
        assertThat(txnProps).containsKey("predictionConfidence");

        Map<String, Object> statsProps = json.read("$.components.schemas.RefreshStats.properties");
        assertThat(statsProps).containsKey("hitRate");
        assertThat(statsProps).containsKey("entriesPerTier");
        assertThat(statsProps).containsKey("lastMined");
        assertThat(statsProps).containsKey("patternsDiscovered");
    }

    @Test
    void actuatorHealth_isExposed() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator/health", String.class);
        assertThat(response.getStatusCode()).isNotEqualTo(HttpStatus.NOT_FOUND);
    }
}
