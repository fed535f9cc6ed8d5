package dockhand.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ApiKeyRecord")
class ApiKeyRecordTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static ApiKeyRecord.Builder key() {
        return ApiKeyRecord.builder("key-1", "hash-1").ownerRef("admin-1").scope(CredentialScope.courier("ACME"));
    }

    @Nested
    @DisplayName("canUse")
    class CanUse {

        @Test
        @DisplayName("should be usable when active without expiry")
        void activeWithoutExpiry() {
            assertTrue(key().build().canUse(NOW));
        }

        @Test
        @DisplayName("should not be usable when deactivated")
        void deactivated() {
            assertFalse(key().active(false).build().canUse(NOW));
        }

        @Test
        @DisplayName("should treat the expiry instant itself as expired")
        void expiresAtBoundary() {
            var apiKey = key().expiresAt(NOW).build();

            assertTrue(apiKey.isExpired(NOW));
            assertFalse(apiKey.canUse(NOW));
            assertTrue(apiKey.canUse(NOW.minusMillis(1)));
        }

        @Test
        @DisplayName("should stay unusable when re-activated after expiry")
        void reactivatedAfterExpiry() {
            var apiKey = key().active(false).expiresAt(NOW.minus(Duration.ofDays(1))).build();

            assertFalse(apiKey.withActive(true, NOW).canUse(NOW));
        }
    }

    @Nested
    @DisplayName("targeted copies")
    class Copies {

        @Test
        @DisplayName("withUsage should add one and keep updatedAt")
        void withUsage() {
            var apiKey = key().usageCount(4).updatedAt(NOW).build();

            var used = apiKey.withUsage(NOW.plusSeconds(60));

            assertEquals(5, used.usageCount());
            assertEquals(NOW.plusSeconds(60), used.lastUsedAt());
            assertEquals(NOW, used.updatedAt());
        }

        @Test
        @DisplayName("withActive should keep usage fields")
        void withActive() {
            var apiKey = key().usageCount(9).lastUsedAt(NOW).build();

            var toggled = apiKey.withActive(false, NOW.plusSeconds(5));

            assertFalse(toggled.active());
            assertEquals(9, toggled.usageCount());
            assertEquals(NOW, toggled.lastUsedAt());
            assertEquals(NOW.plusSeconds(5), toggled.updatedAt());
        }
    }

    @Test
    @DisplayName("should keep permission order")
    void permissionOrder() {
        var apiKey = key().permissions(new java.util.LinkedHashSet<>(List.of("packages:write", "packages:read")))
                .build();

        assertEquals(List.of("packages:write", "packages:read"), List.copyOf(apiKey.permissions()));
    }

    @Test
    @DisplayName("should require an owner")
    void requiresOwner() {
        assertThrows(
                IllegalArgumentException.class,
                () -> ApiKeyRecord.builder("key-1", "hash").permissions(Set.of()).build());
    }

    @Test
    @DisplayName("view should derive the expired flag and carry no hash")
    void viewDerivesExpired() {
        var view = ApiKeyView.of(key().expiresAt(NOW.minusSeconds(1)).build(), NOW);

        assertTrue(view.expired());
        assertTrue(view.active());
        assertFalse(view.usable());
    }
}
