package dockhand.core.port.out;

import dockhand.core.model.auth.SessionVerification;

/**
 * Verifies signed session tokens without a storage round trip.
 */
public interface SessionTokenVerifier {

    /**
     * Check a token's signature, issuer and lifetime.
     *
     * @param token the compact token from the Authorization header
     * @return the verification outcome, never null
     */
    SessionVerification verify(String token);
}
