package dockhand.core.model.auth;

import java.util.Set;

/**
 * Parameters for issuing a new API key.
 *
 * @param name          display name; derived from the scope when null
 * @param description   optional free text
 * @param scope         courier code and/or warehouse the key is restricted to
 * @param permissions   capability tokens; the configured defaults apply when null
 * @param expiresInDays lifetime in days; the configured default applies when null
 * @param rateLimit     optional throttling policy
 */
public record ApiKeyIssueRequest(
        String name,
        String description,
        CredentialScope scope,
        Set<String> permissions,
        Integer expiresInDays,
        RateLimitPolicy rateLimit) {}
