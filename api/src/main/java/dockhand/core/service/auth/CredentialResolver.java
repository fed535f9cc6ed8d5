package dockhand.core.service.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import dockhand.core.config.ApiKeyConfig;
import dockhand.core.model.auth.AccountInactiveException;
import dockhand.core.model.auth.AuthScheme;
import dockhand.core.model.auth.AuthenticationException;
import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.model.auth.CredentialHeaders;
import dockhand.core.model.auth.Principal;
import dockhand.core.model.auth.SessionVerification;
import dockhand.core.port.in.CredentialResolution;
import dockhand.core.port.out.AuthMetrics;
import dockhand.core.port.out.SessionTokenVerifier;
import dockhand.core.port.out.UserAccountRepository;

/**
 * Turns request headers into a {@link Principal}.
 *
 * <p>When an API key header is present it is authoritative: a bad key fails the
 * request even if a valid bearer token is also sent. Successful key resolution
 * queues a usage increment before the principal is returned.
 */
@ApplicationScoped
public class CredentialResolver implements CredentialResolution {

    private static final Logger LOG = Logger.getLogger(CredentialResolver.class);

    private static final String BEARER_HINT = "Authorization: Bearer <token>";

    private final ApiKeyVerifier keyVerifier;
    private final SessionTokenVerifier sessionVerifier;
    private final UserAccountRepository users;
    private final UsageMeteringService metering;
    private final ApiKeyConfig config;
    private final AuthMetrics metrics;

    @Inject
    public CredentialResolver(
            ApiKeyVerifier keyVerifier,
            SessionTokenVerifier sessionVerifier,
            UserAccountRepository users,
            UsageMeteringService metering,
            ApiKeyConfig config,
            AuthMetrics metrics) {
        this.keyVerifier = keyVerifier;
        this.sessionVerifier = sessionVerifier;
        this.users = users;
        this.metering = metering;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<Principal> resolve(CredentialHeaders headers, AuthScheme scheme) {
        return Uni.createFrom()
                .deferred(() -> dispatch(headers, scheme))
                .invoke(principal -> metrics.recordAuthSuccess(principal.kind()))
                .onFailure(AuthenticationException.class)
                .invoke(e -> metrics.recordAuthFailure(((AuthenticationException) e).failure()));
    }

    private Uni<Principal> dispatch(CredentialHeaders headers, AuthScheme scheme) {
        Optional<String> apiKey = headers.firstOf(apiKeyHeaders());
        Optional<String> authorization = headers.authorization();

        switch (scheme) {
            case API_KEY:
                return apiKey.map(this::resolveMachine).orElseGet(() -> missing(apiKeyHint()));
            case SESSION:
                return authorization.map(this::resolveHuman).orElseGet(() -> missing(BEARER_HINT));
            case COMBINED:
            default:
                if (apiKey.isPresent()) {
                    return resolveMachine(apiKey.get());
                }
                if (authorization.isPresent()) {
                    return resolveHuman(authorization.get());
                }
                return missing(apiKeyHint() + " or " + BEARER_HINT);
        }
    }

    private Uni<Principal> resolveMachine(String rawKey) {
        return keyVerifier
                .verify(rawKey)
                .invoke(key -> metering.recordUse(key.id()))
                .map(Principal::machine);
    }

    private Uni<Principal> resolveHuman(String authorization) {
        Optional<String> token = CredentialHeaders.bearerToken(authorization);
        if (token.isEmpty()) {
            return fail(AuthenticationFailure.MALFORMED_CREDENTIAL, "Authorization header carries no token", BEARER_HINT);
        }

        SessionVerification verification = sessionVerifier.verify(token.get());
        if (verification instanceof SessionVerification.Expired expired) {
            LOG.debugf("Expired session token: %s", expired.reason());
            return fail(AuthenticationFailure.SESSION_EXPIRED, "Session token has expired", "Sign in again");
        }
        if (!(verification instanceof SessionVerification.Verified verified)) {
            LOG.debugf("Rejected session token: %s", ((SessionVerification.Invalid) verification).reason());
            return fail(AuthenticationFailure.SESSION_INVALID, "Invalid session token", "Sign in again");
        }

        return users.findById(verified.userId()).map(opt -> {
            var account = opt.orElseThrow(() -> new AuthenticationException(
                    AuthenticationFailure.SESSION_INVALID, "User not found", "Sign in again"));
            if (!account.isActive()) {
                LOG.infof("Session rejected for %s account %s", account.status(), account.id());
                throw new AccountInactiveException(account.id(), account.status());
            }
            return Principal.human(account.id(), account.role());
        });
    }

    private List<String> apiKeyHeaders() {
        List<String> names = new ArrayList<>();
        names.add(config.header());
        names.addAll(config.headerAliases());
        return names;
    }

    private String apiKeyHint() {
        List<String> names = apiKeyHeaders();
        if (names.size() == 1) {
            return names.get(0) + ": <key>";
        }
        return names.get(0) + " (or " + String.join(", ", names.subList(1, names.size())) + "): <key>";
    }

    private static Uni<Principal> missing(String hint) {
        return fail(AuthenticationFailure.MISSING_CREDENTIAL, "Authentication required", hint);
    }

    private static Uni<Principal> fail(AuthenticationFailure failure, String message, String hint) {
        return Uni.createFrom().failure(new AuthenticationException(failure, message, hint));
    }
}
