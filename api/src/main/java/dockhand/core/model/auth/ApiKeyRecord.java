package dockhand.core.model.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A stored machine credential.
 *
 * <p>The raw key is never stored. {@code keyHash} holds its SHA-256 digest and
 * lookups hash the presented value before matching.
 *
 * @param id          opaque identifier used by the admin surface
 * @param keyHash     SHA-256 digest of the raw key
 * @param name        display name
 * @param description optional free text
 * @param ownerRef    id of the user who issued the key
 * @param scope       courier and/or warehouse the key is restricted to
 * @param permissions ordered capability tokens
 * @param active      false once deactivated
 * @param expiresAt   absolute expiry, null for none
 * @param usageCount  number of successful resolutions
 * @param lastUsedAt  time of the most recent successful resolution
 * @param rateLimit   optional throttling policy, null when not configured
 * @param createdAt   creation time
 * @param updatedAt   time of the last administrative change
 */
public record ApiKeyRecord(
        String id,
        String keyHash,
        String name,
        String description,
        String ownerRef,
        CredentialScope scope,
        Set<String> permissions,
        boolean active,
        Instant expiresAt,
        long usageCount,
        Instant lastUsedAt,
        RateLimitPolicy rateLimit,
        Instant createdAt,
        Instant updatedAt) {

    public ApiKeyRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("API key ID cannot be null or blank");
        }
        if (keyHash == null || keyHash.isBlank()) {
            throw new IllegalArgumentException("API key hash cannot be null or blank");
        }
        if (ownerRef == null || ownerRef.isBlank()) {
            throw new IllegalArgumentException("API key owner cannot be null or blank");
        }
        if (usageCount < 0) {
            throw new IllegalArgumentException("Usage count cannot be negative");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        if (scope == null) {
            scope = CredentialScope.unscoped();
        }
        permissions = permissions == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(permissions));
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Whether the key has passed its expiry at {@code now}.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * The usability predicate evaluated on every request: active and not expired.
     */
    public boolean canUse(Instant now) {
        return active && !isExpired(now);
    }

    public ApiKeyRecord withActive(boolean active, Instant now) {
        return new ApiKeyRecord(
                id, keyHash, name, description, ownerRef, scope, permissions, active, expiresAt, usageCount,
                lastUsedAt, rateLimit, createdAt, now);
    }

    public ApiKeyRecord withUsage(Instant usedAt) {
        return new ApiKeyRecord(
                id, keyHash, name, description, ownerRef, scope, permissions, active, expiresAt, usageCount + 1,
                usedAt, rateLimit, createdAt, updatedAt);
    }

    public static Builder builder(String id, String keyHash) {
        return new Builder(id, keyHash);
    }

    public static class Builder {
        private final String id;
        private final String keyHash;
        private String name;
        private String description;
        private String ownerRef;
        private CredentialScope scope = CredentialScope.unscoped();
        private Set<String> permissions = Set.of();
        private boolean active = true;
        private Instant expiresAt;
        private long usageCount;
        private Instant lastUsedAt;
        private RateLimitPolicy rateLimit;
        private Instant createdAt = Instant.now();
        private Instant updatedAt;

        private Builder(String id, String keyHash) {
            this.id = id;
            this.keyHash = keyHash;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder ownerRef(String ownerRef) {
            this.ownerRef = ownerRef;
            return this;
        }

        public Builder scope(CredentialScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder permissions(Set<String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder usageCount(long usageCount) {
            this.usageCount = usageCount;
            return this;
        }

        public Builder lastUsedAt(Instant lastUsedAt) {
            this.lastUsedAt = lastUsedAt;
            return this;
        }

        public Builder rateLimit(RateLimitPolicy rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public ApiKeyRecord build() {
            return new ApiKeyRecord(
                    id, keyHash, name, description, ownerRef, scope, permissions, active, expiresAt, usageCount,
                    lastUsedAt, rateLimit, createdAt, updatedAt);
        }
    }
}
