package dockhand.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dockhand.adapter.out.storage.memory.InMemoryApiKeyRepository;
import dockhand.core.model.auth.ApiKeyRecord;
import dockhand.core.model.auth.AuthenticationException;
import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.model.auth.CredentialHeaders;
import dockhand.core.model.auth.CredentialScope;
import dockhand.core.model.auth.WebhookContext;
import dockhand.core.port.out.AuthMetrics;
import dockhand.mock.MockConfigs;

@DisplayName("WebhookCredentialResolver")
class WebhookCredentialResolverTest {

    private static final String RAW_KEY = "dk_webhookKey";

    private UsageMeteringService metering;
    private WebhookCredentialResolver resolver;

    @BeforeEach
    void setUp() {
        var repository = new InMemoryApiKeyRepository();
        repository
                .insert(ApiKeyRecord.builder("hook-1", ApiKeyHashing.hash(RAW_KEY))
                        .name("KCD ACME Integration")
                        .ownerRef("admin-1")
                        .scope(CredentialScope.courier("ACME"))
                        .build())
                .await()
                .indefinitely();
        repository
                .insert(ApiKeyRecord.builder("hook-2", ApiKeyHashing.hash("dk_warehouseHook"))
                        .name("Dock door sensors")
                        .ownerRef("admin-1")
                        .scope(CredentialScope.warehouse("wh-main"))
                        .build())
                .await()
                .indefinitely();
        metering = mock(UsageMeteringService.class);
        resolver = new WebhookCredentialResolver(
                new ApiKeyVerifier(repository), metering, MockConfigs.apiKeys(), mock(AuthMetrics.class));
    }

    private WebhookContext authenticate(Map<String, String> headers) {
        return resolver.authenticate(CredentialHeaders.ofSingle(headers)).await().indefinitely();
    }

    @Test
    @DisplayName("should accept each webhook header alias")
    void acceptsAliases() {
        for (String header : new String[] {"X-KCD-API-Key", "X-API-Key", "X-Webhook-Key"}) {
            var context = authenticate(Map.of(header, RAW_KEY));

            assertEquals("ACME", context.source());
            assertEquals("hook-1", context.keyId());
            assertNotNull(context.validatedAt());
        }
    }

    @Test
    @DisplayName("should use the key name as source for warehouse keys")
    void sourceFromName() {
        var context = authenticate(Map.of("X-Webhook-Key", "dk_warehouseHook"));

        assertEquals("Dock door sensors", context.source());
    }

    @Test
    @DisplayName("should meter successful webhook calls")
    void meters() {
        authenticate(Map.of("X-API-Key", RAW_KEY));

        verify(metering).recordUse("hook-1");
    }

    @Test
    @DisplayName("should not fall back to a bearer token")
    void noBearerFallback() {
        var e = assertThrows(
                AuthenticationException.class, () -> authenticate(Map.of("Authorization", "Bearer " + RAW_KEY)));

        assertEquals(AuthenticationFailure.MISSING_CREDENTIAL, e.failure());
        verify(metering, never()).recordUse(anyString());
    }

    @Test
    @DisplayName("should report an unknown key")
    void unknownKey() {
        var e = assertThrows(AuthenticationException.class, () -> authenticate(Map.of("X-API-Key", "dk_nope")));

        assertEquals(AuthenticationFailure.CREDENTIAL_NOT_FOUND, e.failure());
    }
}
