package dockhand.core.service.auth;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import dockhand.core.model.auth.ForbiddenException;
import dockhand.core.model.auth.Principal;
import dockhand.core.model.auth.RouteRequirement;
import dockhand.core.model.auth.UserRole;
import dockhand.core.port.out.AuthMetrics;

/**
 * Decides whether a resolved principal may use a route.
 *
 * <p>Humans need a role listed by the route; roles do not inherit from each other.
 * Machines need every permission the route lists and, when the route targets a
 * courier-owned resource, a matching courier scope. The scope check runs first.
 */
@ApplicationScoped
public class AuthorizationService {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    private final AuthMetrics metrics;

    @Inject
    public AuthorizationService(AuthMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Check a principal against a route that does not touch courier-owned data.
     *
     * @throws ForbiddenException if access is denied
     */
    public void authorize(Principal principal, RouteRequirement requirement) {
        authorize(principal, requirement, null);
    }

    /**
     * Check a principal against a route.
     *
     * @param principal           the resolved principal
     * @param requirement         the route's requirement
     * @param resourceCourierCode courier owning the targeted resource, or null
     * @throws ForbiddenException if access is denied
     */
    public void authorize(Principal principal, RouteRequirement requirement, String resourceCourierCode) {
        if (principal.isHuman()) {
            checkRole(principal, requirement);
        } else {
            if (resourceCourierCode != null) {
                checkScope(principal, resourceCourierCode);
            }
            checkPermissions(principal, requirement);
        }
    }

    private void checkRole(Principal principal, RouteRequirement requirement) {
        if (requirement.roles().contains(principal.role())) {
            return;
        }
        String required = requirement.admitsHumans()
                ? "role: " + requirement.roles().stream().map(UserRole::value).sorted().collect(Collectors.joining(" | "))
                : "API key (no user session access)";
        throw deny(
                principal,
                ForbiddenException.Kind.FORBIDDEN,
                "Access denied for role " + principal.role().value(),
                required,
                "role: " + principal.role().value());
    }

    private void checkScope(Principal principal, String resourceCourierCode) {
        String keyCourier = principal.scope().courierCode();
        if (keyCourier != null && keyCourier.equals(resourceCourierCode)) {
            return;
        }
        throw deny(
                principal,
                ForbiddenException.Kind.SCOPE_MISMATCH,
                "API key is not scoped to courier " + resourceCourierCode,
                "courier: " + resourceCourierCode,
                keyCourier != null ? "courier: " + keyCourier : "scope: " + principal.scope());
    }

    private void checkPermissions(Principal principal, RouteRequirement requirement) {
        Set<String> missing = new LinkedHashSet<>(requirement.permissions());
        missing.removeAll(principal.permissions());
        if (missing.isEmpty()) {
            return;
        }
        throw deny(
                principal,
                ForbiddenException.Kind.FORBIDDEN,
                "API key lacks permission(s) " + missing,
                "permissions: " + requirement.permissions(),
                "permissions: " + principal.permissions());
    }

    private ForbiddenException deny(
            Principal principal, ForbiddenException.Kind kind, String message, String required, String actual) {
        LOG.debugf("Access denied for %s: %s (required %s, actual %s)", principal.describe(), message, required, actual);
        metrics.recordAccessDenied(principal.kind(), kind.code());
        return new ForbiddenException(kind, message, required, actual);
    }
}
