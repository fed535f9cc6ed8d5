package dockhand.core.model.auth;

import java.time.Instant;

/**
 * Outcome of verifying a signed session token.
 */
public sealed interface SessionVerification {

    /**
     * Signature and lifetime checks passed.
     *
     * @param userId    the subject the token asserts
     * @param issuedAt  issue time
     * @param expiresAt expiry time
     */
    record Verified(String userId, Instant issuedAt, Instant expiresAt) implements SessionVerification {
        public Verified {
            if (userId == null || userId.isBlank()) {
                throw new IllegalArgumentException("User ID cannot be null or blank");
            }
        }
    }

    /**
     * The token was authentic but its lifetime has passed.
     */
    record Expired(String reason) implements SessionVerification {}

    /**
     * The token could not be parsed or its signature did not verify.
     */
    record Invalid(String reason) implements SessionVerification {}
}
