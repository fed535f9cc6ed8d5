package dockhand.core.model.auth;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What a route demands from a resolved principal.
 *
 * <p>Human principals are checked against {@code roles}; machine principals
 * must hold every token in {@code permissions}.
 */
public record RouteRequirement(Set<UserRole> roles, Set<String> permissions) {

    public RouteRequirement {
        roles = roles == null || roles.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
        permissions = permissions == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
    }

    public static RouteRequirement roles(UserRole... roles) {
        return new RouteRequirement(Set.of(roles), Set.of());
    }

    public static RouteRequirement permissions(String... permissions) {
        return new RouteRequirement(Set.of(), new LinkedHashSet<>(List.of(permissions)));
    }

    /**
     * Adds permission tokens for machine callers to a role requirement.
     */
    public RouteRequirement andPermissions(String... extra) {
        var merged = new LinkedHashSet<>(permissions);
        merged.addAll(List.of(extra));
        return new RouteRequirement(roles, merged);
    }

    public boolean admitsHumans() {
        return !roles.isEmpty();
    }
}
