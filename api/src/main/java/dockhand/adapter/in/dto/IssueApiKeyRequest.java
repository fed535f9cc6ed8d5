package dockhand.adapter.in.dto;

import java.util.Set;

import com.fasterxml.jackson.annotation.JsonAlias;

import dockhand.core.model.auth.ApiKeyIssueRequest;
import dockhand.core.model.auth.CredentialScope;

/**
 * DTO for API key issuance requests.
 *
 * @param courierCode   courier the key is scoped to
 * @param warehouseId   warehouse the key is scoped to
 * @param name          display name (derived from the scope when omitted)
 * @param description   optional description of the key's purpose
 * @param permissions   permissions to grant (configured defaults when omitted)
 * @param expiresInDays lifetime in days, also accepted as {@code expiresIn}
 * @param rateLimit     optional request budget
 */
public record IssueApiKeyRequest(
        String courierCode,
        String warehouseId,
        String name,
        String description,
        Set<String> permissions,
        @JsonAlias("expiresIn") Integer expiresInDays,
        RateLimitDto rateLimit) {

    public ApiKeyIssueRequest toModel() {
        return new ApiKeyIssueRequest(
                name,
                description,
                new CredentialScope(courierCode, warehouseId),
                permissions,
                expiresInDays,
                rateLimit != null ? rateLimit.toModel() : null);
    }
}
