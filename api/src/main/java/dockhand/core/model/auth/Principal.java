package dockhand.core.model.auth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * The identity resolved for one request.
 *
 * <p>Built fresh by the credential resolver for every request and handed to the
 * handler explicitly. It is never persisted.
 *
 * @param kind        human session or machine key
 * @param id          user id for humans, API key id for machines
 * @param role        role of a human principal; null for machines
 * @param permissions capability tokens of a machine principal; empty for humans
 * @param scope       courier/warehouse restriction of a machine principal
 * @param ownerRef    for machines, the user who issued the key
 */
public record Principal(
        PrincipalKind kind,
        String id,
        UserRole role,
        Set<String> permissions,
        CredentialScope scope,
        String ownerRef) {

    public Principal {
        if (kind == null) {
            throw new IllegalArgumentException("Principal kind cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Principal ID cannot be null or blank");
        }
        if (kind == PrincipalKind.HUMAN && role == null) {
            throw new IllegalArgumentException("Human principals must carry a role");
        }
        permissions = permissions == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
        if (scope == null) {
            scope = CredentialScope.unscoped();
        }
    }

    public static Principal human(String userId, UserRole role) {
        return new Principal(PrincipalKind.HUMAN, userId, role, Set.of(), CredentialScope.unscoped(), null);
    }

    public static Principal machine(ApiKeyRecord key) {
        return new Principal(PrincipalKind.MACHINE, key.id(), null, key.permissions(), key.scope(), key.ownerRef());
    }

    public boolean isHuman() {
        return kind == PrincipalKind.HUMAN;
    }

    public boolean isMachine() {
        return kind == PrincipalKind.MACHINE;
    }

    public Optional<UserRole> roleIfHuman() {
        return Optional.ofNullable(role);
    }

    /**
     * Short description for logs and error messages. Never includes secrets.
     */
    public String describe() {
        if (isHuman()) {
            return "user " + id + " (role " + role.value() + ")";
        }
        return "api key " + id + " (" + scope + ")";
    }
}
