package dockhand.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dockhand.core.model.auth.ApiKeyRecord;
import dockhand.core.model.auth.CredentialScope;
import dockhand.core.model.auth.ForbiddenException;
import dockhand.core.model.auth.Permissions;
import dockhand.core.model.auth.Principal;
import dockhand.core.model.auth.PrincipalKind;
import dockhand.core.model.auth.RouteRequirement;
import dockhand.core.model.auth.UserRole;
import dockhand.core.port.out.AuthMetrics;

@DisplayName("AuthorizationService")
class AuthorizationServiceTest {

    private AuthMetrics metrics;
    private AuthorizationService authorization;

    @BeforeEach
    void setUp() {
        metrics = mock(AuthMetrics.class);
        authorization = new AuthorizationService(metrics);
    }

    private static Principal machine(String courierCode, String... permissions) {
        return Principal.machine(ApiKeyRecord.builder("key-" + courierCode, "hash-" + courierCode)
                .ownerRef("admin-1")
                .scope(CredentialScope.courier(courierCode))
                .permissions(new LinkedHashSet<>(List.of(permissions)))
                .build());
    }

    @Nested
    @DisplayName("humans")
    class Humans {

        @Test
        @DisplayName("should admit a listed role")
        void listedRole() {
            var requirement = RouteRequirement.roles(UserRole.ADMIN, UserRole.WAREHOUSE_STAFF);

            assertDoesNotThrow(
                    () -> authorization.authorize(Principal.human("u1", UserRole.WAREHOUSE_STAFF), requirement));
        }

        @Test
        @DisplayName("should not let admin satisfy a customer-only route")
        void noHierarchy() {
            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(
                            Principal.human("u1", UserRole.ADMIN), RouteRequirement.roles(UserRole.CUSTOMER)));

            assertEquals(ForbiddenException.Kind.FORBIDDEN, e.kind());
            assertEquals("role: customer", e.required());
            assertEquals("role: admin", e.actual());
        }

        @Test
        @DisplayName("should refuse humans on a key-only route")
        void keyOnlyRoute() {
            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(
                            Principal.human("u1", UserRole.ADMIN),
                            RouteRequirement.permissions(Permissions.PACKAGES_READ)));

            assertEquals(ForbiddenException.Kind.FORBIDDEN, e.kind());
            verify(metrics).recordAccessDenied(PrincipalKind.HUMAN, "forbidden");
        }

        @Test
        @DisplayName("should skip courier scope checks for humans")
        void noScopeForHumans() {
            var requirement = RouteRequirement.roles(UserRole.WAREHOUSE_STAFF).andPermissions("packages:read");

            assertDoesNotThrow(() ->
                    authorization.authorize(Principal.human("u1", UserRole.WAREHOUSE_STAFF), requirement, "OTHER"));
        }
    }

    @Nested
    @DisplayName("machines")
    class Machines {

        @Test
        @DisplayName("should require every listed permission")
        void conjunction() {
            var requirement = RouteRequirement.permissions(Permissions.PACKAGES_READ, Permissions.PACKAGES_WRITE);

            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(machine("ACME", Permissions.PACKAGES_READ), requirement));

            assertEquals(ForbiddenException.Kind.FORBIDDEN, e.kind());
            assertTrue(e.required().contains("packages:write"));
            assertTrue(e.actual().contains("packages:read"));
        }

        @Test
        @DisplayName("should admit a key holding a superset of the permissions")
        void superset() {
            var requirement = RouteRequirement.permissions(Permissions.PACKAGES_READ);

            assertDoesNotThrow(() -> authorization.authorize(
                    machine("ACME", Permissions.PACKAGES_READ, Permissions.PACKAGES_WRITE), requirement));
        }

        @Test
        @DisplayName("should admit any key on a route without permissions")
        void noPermissionsRequired() {
            assertDoesNotThrow(
                    () -> authorization.authorize(machine("ACME"), RouteRequirement.roles(UserRole.ADMIN)));
        }

        @Test
        @DisplayName("should report a courier mismatch as scope mismatch")
        void scopeMismatch() {
            var requirement = RouteRequirement.permissions(Permissions.PACKAGES_READ);

            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(machine("ACME", Permissions.PACKAGES_READ), requirement, "OTHER"));

            assertEquals(ForbiddenException.Kind.SCOPE_MISMATCH, e.kind());
            assertEquals("courier: OTHER", e.required());
            assertEquals("courier: ACME", e.actual());
            verify(metrics).recordAccessDenied(PrincipalKind.MACHINE, "scope_mismatch");
        }

        @Test
        @DisplayName("should check scope before permissions")
        void scopeFirst() {
            var requirement = RouteRequirement.permissions(Permissions.PACKAGES_READ);

            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(machine("ACME"), requirement, "OTHER"));

            assertEquals(ForbiddenException.Kind.SCOPE_MISMATCH, e.kind());
        }

        @Test
        @DisplayName("should require the courier code to match exactly")
        void courierMatchIsExact() {
            var requirement = RouteRequirement.permissions(Permissions.PACKAGES_READ);

            assertDoesNotThrow(() ->
                    authorization.authorize(machine("ACME", Permissions.PACKAGES_READ), requirement, "ACME"));
            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(machine("ACME", Permissions.PACKAGES_READ), requirement, "acme"));
            assertEquals(ForbiddenException.Kind.SCOPE_MISMATCH, e.kind());
        }

        @Test
        @DisplayName("should report missing permission on the key's own courier")
        void ownCourierMissingPermission() {
            var requirement = RouteRequirement.permissions(Permissions.PACKAGES_READ);

            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(machine("ACME", Permissions.PARTNER_INTEGRATION), requirement, "ACME"));

            assertEquals(ForbiddenException.Kind.FORBIDDEN, e.kind());
        }

        @Test
        @DisplayName("should refuse a warehouse-only key on a courier-owned resource")
        void warehouseKey() {
            var principal = Principal.machine(ApiKeyRecord.builder("wh-key", "wh-hash")
                    .ownerRef("admin-1")
                    .scope(CredentialScope.warehouse("wh-main"))
                    .permissions(Set.of(Permissions.PACKAGES_READ))
                    .build());

            var e = assertThrows(
                    ForbiddenException.class,
                    () -> authorization.authorize(
                            principal, RouteRequirement.permissions(Permissions.PACKAGES_READ), "ACME"));

            assertEquals(ForbiddenException.Kind.SCOPE_MISMATCH, e.kind());
            assertEquals("scope: warehouse=wh-main", e.actual());
        }
    }
}
