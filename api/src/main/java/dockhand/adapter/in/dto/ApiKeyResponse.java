package dockhand.adapter.in.dto;

import java.time.Instant;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

import dockhand.core.model.auth.ApiKeyView;

/**
 * API key as returned by the admin endpoints. Never carries the raw key or its hash.
 */
public record ApiKeyResponse(
        String id,
        String name,
        String description,
        String courierCode,
        String warehouseId,
        Set<String> permissions,
        @JsonProperty("isActive") boolean active,
        @JsonProperty("isExpired") boolean expired,
        Instant expiresAt,
        long usageCount,
        Instant lastUsedAt,
        RateLimitDto rateLimit,
        String createdBy,
        Instant createdAt,
        Instant updatedAt) {

    public static ApiKeyResponse fromModel(ApiKeyView key) {
        return new ApiKeyResponse(
                key.id(),
                key.name(),
                key.description(),
                key.scope().courierCode(),
                key.scope().warehouseId(),
                key.permissions(),
                key.active(),
                key.expired(),
                key.expiresAt(),
                key.usageCount(),
                key.lastUsedAt(),
                RateLimitDto.fromModel(key.rateLimit()),
                key.ownerRef(),
                key.createdAt(),
                key.updatedAt());
    }
}
