package dockhand.core.service.auth;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import dockhand.core.model.auth.ApiKeyRecord;
import dockhand.core.model.auth.AuthenticationException;
import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.port.out.ApiKeyRepository;

/**
 * Looks up a presented raw key and classifies why it cannot be used.
 *
 * <p>Shared by the API and webhook resolvers. Expiry is reported ahead of
 * deactivation when both apply.
 */
@ApplicationScoped
public class ApiKeyVerifier {

    private static final Logger LOG = Logger.getLogger(ApiKeyVerifier.class);

    static final int MAX_KEY_LENGTH = 256;
    static final String REISSUE_HINT = "Ask an administrator to issue a new key via POST /api/admin/api-keys";

    private final ApiKeyRepository repository;

    @Inject
    public ApiKeyVerifier(ApiKeyRepository repository) {
        this.repository = repository;
    }

    /**
     * Resolve a raw key to a usable stored key.
     *
     * @param rawKey the header value, already trimmed
     * @return Uni with the key, or failed with {@link AuthenticationException}
     */
    public Uni<ApiKeyRecord> verify(String rawKey) {
        if (rawKey == null || rawKey.isEmpty() || rawKey.length() > MAX_KEY_LENGTH || containsWhitespace(rawKey)) {
            return Uni.createFrom()
                    .failure(new AuthenticationException(
                            AuthenticationFailure.MALFORMED_CREDENTIAL,
                            "API key header is empty or not a well-formed key",
                            "Send the key exactly as issued, without spaces"));
        }

        return repository.findByKeyHash(ApiKeyHashing.hash(rawKey)).map(opt -> {
            if (opt.isEmpty()) {
                LOG.debugf("Unknown API key presented (prefix %s)", prefixOf(rawKey));
                throw new AuthenticationException(
                        AuthenticationFailure.CREDENTIAL_NOT_FOUND, "Invalid API key", REISSUE_HINT);
            }
            ApiKeyRecord key = opt.get();
            Instant now = Instant.now();
            if (key.isExpired(now)) {
                LOG.debugf("Expired API key presented: id=%s, expiredAt=%s", key.id(), key.expiresAt());
                throw new AuthenticationException(
                        AuthenticationFailure.CREDENTIAL_EXPIRED,
                        "API key expired at " + key.expiresAt(),
                        REISSUE_HINT);
            }
            if (!key.active()) {
                LOG.debugf("Deactivated API key presented: id=%s", key.id());
                throw new AuthenticationException(
                        AuthenticationFailure.CREDENTIAL_INACTIVE,
                        "API key has been deactivated",
                        "Ask an administrator to reactivate the key or issue a new one");
            }
            return key;
        });
    }

    private static boolean containsWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static String prefixOf(String rawKey) {
        return rawKey.length() <= 6 ? "***" : rawKey.substring(0, 6) + "...";
    }
}
