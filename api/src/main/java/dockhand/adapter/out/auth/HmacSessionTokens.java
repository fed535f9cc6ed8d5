package dockhand.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import dockhand.core.config.SessionConfig;
import dockhand.core.model.auth.SessionVerification;
import dockhand.core.port.out.SessionTokenVerifier;

/**
 * HS256 session tokens shared with the login service.
 *
 * <p>The user id travels in {@code sub}. Tokens from older logins that carry a
 * {@code userId} claim instead are still accepted.
 */
@ApplicationScoped
public class HmacSessionTokens implements SessionTokenVerifier {

    private static final Logger LOG = Logger.getLogger(HmacSessionTokens.class);

    static final String LEGACY_USER_CLAIM = "userId";
    private static final int MIN_SECRET_BYTES = 32;

    private final HmacKey key;
    private final SessionConfig config;
    private final JwtConsumer consumer;

    @Inject
    public HmacSessionTokens(SessionConfig config) {
        byte[] secret = config.secret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "dockhand.auth.session.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = new HmacKey(secret);
        this.config = config;
        this.consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) config.clockSkew().toSeconds())
                .setExpectedIssuer(config.issuer())
                .setSkipDefaultAudienceValidation()
                .setVerificationKey(key)
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .build();
    }

    @Override
    public SessionVerification verify(String token) {
        try {
            JwtClaims claims = consumer.processToClaims(token);
            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                userId = claims.getClaimValueAsString(LEGACY_USER_CLAIM);
            }
            if (userId == null || userId.isBlank()) {
                return new SessionVerification.Invalid("Token carries no user id");
            }
            NumericDate issuedAt = claims.getIssuedAt();
            return new SessionVerification.Verified(
                    userId,
                    issuedAt != null ? Instant.ofEpochSecond(issuedAt.getValue()) : null,
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()));
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                return new SessionVerification.Expired("Token has expired");
            }
            LOG.debugv("Session token rejected: {0}", e.getMessage());
            return new SessionVerification.Invalid("Token validation failed");
        } catch (MalformedClaimException e) {
            return new SessionVerification.Invalid("Malformed claims: " + e.getMessage());
        }
    }

    /**
     * Mint a token for a user with the configured lifetime.
     */
    public String issue(String userId) {
        return issue(userId, Instant.now(), config.ttl());
    }

    /**
     * Mint a token for a user.
     *
     * @param userId   subject
     * @param issuedAt issue time
     * @param ttl      lifetime from {@code issuedAt}
     * @return compact JWS
     */
    public String issue(String userId, Instant issuedAt, Duration ttl) {
        JwtClaims claims = new JwtClaims();
        claims.setIssuer(config.issuer());
        claims.setSubject(userId);
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(issuedAt.plus(ttl).getEpochSecond()));
        claims.setGeneratedJwtId();

        var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign session token: " + e.getMessage(), e);
        }
    }
}
