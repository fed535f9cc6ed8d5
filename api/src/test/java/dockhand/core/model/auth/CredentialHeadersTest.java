package dockhand.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CredentialHeaders")
class CredentialHeadersTest {

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("should match header names case-insensitively")
        void caseInsensitive() {
            var headers = CredentialHeaders.ofSingle(Map.of("x-api-key", "dk_abc"));

            assertEquals(Optional.of("dk_abc"), headers.get("X-API-Key"));
        }

        @Test
        @DisplayName("should use the first value of a repeated header")
        void firstValueWins() {
            var headers = CredentialHeaders.of(Map.of("X-API-Key", List.of("first", "second")));

            assertEquals(Optional.of("first"), headers.get("x-api-key"));
        }

        @Test
        @DisplayName("should return the first present name in order")
        void firstOfRespectsOrder() {
            var headers = CredentialHeaders.ofSingle(Map.of("X-Webhook-Key", "c", "X-API-Key", "b"));

            assertEquals(
                    Optional.of("b"), headers.firstOf(List.of("X-KCD-API-Key", "X-API-Key", "X-Webhook-Key")));
        }

        @Test
        @DisplayName("should report a blank header as present but empty")
        void blankHeaderIsPresent() {
            var headers = CredentialHeaders.ofSingle(Map.of("X-API-Key", "   "));

            assertEquals(Optional.of(""), headers.get("X-API-Key"));
        }
    }

    @Nested
    @DisplayName("bearerToken")
    class BearerToken {

        @Test
        @DisplayName("should strip the Bearer prefix")
        void stripsPrefix() {
            assertEquals(Optional.of("abc.def.ghi"), CredentialHeaders.bearerToken("Bearer abc.def.ghi"));
        }

        @Test
        @DisplayName("should accept a lower-case prefix")
        void lowerCasePrefix() {
            assertEquals(Optional.of("tok"), CredentialHeaders.bearerToken("bearer tok"));
        }

        @Test
        @DisplayName("should accept a bare token")
        void bareToken() {
            assertEquals(Optional.of("tok"), CredentialHeaders.bearerToken("tok"));
        }

        @Test
        @DisplayName("should collapse a doubled prefix")
        void doubledPrefix() {
            assertEquals(Optional.of("tok"), CredentialHeaders.bearerToken("Bearer Bearer tok"));
        }

        @Test
        @DisplayName("should return empty when only the prefix is sent")
        void prefixOnly() {
            assertTrue(CredentialHeaders.bearerToken("Bearer ").isEmpty());
            assertTrue(CredentialHeaders.bearerToken("Bearer").isEmpty());
        }
    }
}
