package dockhand.core.model.auth;

import java.time.Instant;
import java.util.Set;

/**
 * An API key as returned by every read path. Carries no secret material.
 *
 * @param expired derived at read time: {@code expiresAt} has passed
 */
public record ApiKeyView(
        String id,
        String name,
        String description,
        String ownerRef,
        CredentialScope scope,
        Set<String> permissions,
        boolean active,
        boolean expired,
        Instant expiresAt,
        long usageCount,
        Instant lastUsedAt,
        RateLimitPolicy rateLimit,
        Instant createdAt,
        Instant updatedAt) {

    public static ApiKeyView of(ApiKeyRecord key, Instant now) {
        return new ApiKeyView(
                key.id(),
                key.name(),
                key.description(),
                key.ownerRef(),
                key.scope(),
                key.permissions(),
                key.active(),
                key.isExpired(now),
                key.expiresAt(),
                key.usageCount(),
                key.lastUsedAt(),
                key.rateLimit(),
                key.createdAt(),
                key.updatedAt());
    }

    /**
     * Whether the key would currently pass authentication.
     */
    public boolean usable() {
        return active && !expired;
    }
}
