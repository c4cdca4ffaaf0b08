package triage.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.equalTo;

import java.util.Map;
import java.util.UUID;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Integration tests running against an explicit policy document.
 */
@QuarkusTest
@TestProfile(RateLimitPolicyDocumentTest.PolicyDocumentProfile.class)
@DisplayName("Rate Limit Policy Document Tests")
class RateLimitPolicyDocumentTest {

    public static class PolicyDocumentProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of("triage.rate-limiting.policy.path", "src/test/resources/policies/rate_limits.yml");
        }
    }

    private static String checkBody(String subjectId, String role, String operation, boolean emergency) {
        return """
                {"subject_id": "%s", "role": "%s", "operation": "%s", "emergency": %s}
                """
                .formatted(subjectId, role, operation, emergency);
    }

    @Test
    @DisplayName("should enforce limits from the document")
    void shouldEnforceDocumentLimits() {
        final var subjectId = "rx-" + UUID.randomUUID();
        for (int i = 0; i < 2; i++) {
            given().contentType(ContentType.JSON)
                    .body(checkBody(subjectId, "receptionist", "api_general", false))
                    .when()
                    .post("/rate-limits/check")
                    .then()
                    .statusCode(200)
                    .header("X-RateLimit-Limit", "2")
                    .header("X-RateLimit-Policy-Version", "test-7")
                    .header("X-RateLimit-Policy-Source", endsWith("rate_limits.yml"));
        }

        given().contentType(ContentType.JSON)
                .body(checkBody(subjectId, "receptionist", "api_general", false))
                .when()
                .post("/rate-limits/check")
                .then()
                .statusCode(429);
    }

    @Test
    @DisplayName("should keep built-in limits for pairs the document leaves out")
    void shouldKeepBuiltInLimits() {
        given().contentType(ContentType.JSON)
                .body(checkBody("dr-" + UUID.randomUUID(), "doctor", "patient_access", false))
                .when()
                .post("/rate-limits/check")
                .then()
                .statusCode(200)
                .header("X-RateLimit-Limit", "180")
                .header("X-RateLimit-Policy-Version", "test-7");
    }

    @Test
    @DisplayName("should honour a bypass flag set by the document")
    void shouldHonourDocumentBypassFlag() {
        given().contentType(ContentType.JSON)
                .body(checkBody("rs-" + UUID.randomUUID(), "research", "emergency", true))
                .when()
                .post("/rate-limits/check")
                .then()
                .statusCode(200)
                .header("X-RateLimit-Emergency-Bypass", "active");
    }

    @Test
    @DisplayName("should report the document on reload")
    void shouldReportDocumentOnReload() {
        given().when()
                .post("/rate-limits/policy/reload")
                .then()
                .statusCode(200)
                .body("policy_version", equalTo("test-7"))
                .body("source", endsWith("rate_limits.yml"));
    }
}
