package dockhand;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

import java.time.Duration;
import java.util.Set;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dockhand.core.model.auth.ApiKeyIssueRequest;
import dockhand.core.model.auth.CredentialScope;
import dockhand.core.port.in.ApiKeyManagement;

@QuarkusTest
@DisplayName("Webhook Resource Tests")
public class WebhookResourceTest {

    @Inject
    ApiKeyManagement keys;

    private String rawKey;

    @BeforeEach
    void setUp() {
        rawKey = keys.issue(
                        "admin-1",
                        new ApiKeyIssueRequest(null, null, CredentialScope.courier("KCD"), Set.of(), null, null))
                .await()
                .atMost(Duration.ofSeconds(5))
                .rawKey();
    }

    @Test
    @DisplayName("should acknowledge a webhook sent with the partner header")
    void shouldAcknowledge() {
        given().contentType(ContentType.JSON)
                .header("X-KCD-API-Key", rawKey)
                .body("{\"trackingNumber\": \"TRK-1\"}")
                .when()
                .post("/api/webhooks/partner/package-created")
                .then()
                .statusCode(202)
                .body("event", equalTo("package-created"))
                .body("source", equalTo("KCD"))
                .body("validatedAt", notNullValue());
    }

    @Test
    @DisplayName("should accept the webhook key header")
    void shouldAcceptWebhookHeader() {
        given().contentType(ContentType.JSON)
                .header("X-Webhook-Key", rawKey)
                .body("{}")
                .when()
                .post("/api/webhooks/partner/test")
                .then()
                .statusCode(202);
    }

    @Test
    @DisplayName("should reject a webhook without a key")
    void shouldRejectMissingKey() {
        given().contentType(ContentType.JSON)
                .body("{}")
                .when()
                .post("/api/webhooks/partner/package-created")
                .then()
                .statusCode(401)
                .body("failure", equalTo("missing_credential"));
    }

    @Test
    @DisplayName("should reject an unknown key")
    void shouldRejectUnknownKey() {
        given().contentType(ContentType.JSON)
                .header("X-KCD-API-Key", "dk_notarealkey")
                .body("{}")
                .when()
                .post("/api/webhooks/partner/package-created")
                .then()
                .statusCode(401)
                .body("failure", equalTo("credential_not_found"));
    }

    @Test
    @DisplayName("should return 404 for an unknown event")
    void shouldReturn404ForUnknownEvent() {
        given().contentType(ContentType.JSON)
                .header("X-KCD-API-Key", rawKey)
                .body("{}")
                .when()
                .post("/api/webhooks/partner/no-such-event")
                .then()
                .statusCode(404);
    }
}
