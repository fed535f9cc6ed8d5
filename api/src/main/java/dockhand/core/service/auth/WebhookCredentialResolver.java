package dockhand.core.service.auth;

import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import dockhand.core.config.ApiKeyConfig;
import dockhand.core.model.auth.AuthenticationException;
import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.model.auth.CredentialHeaders;
import dockhand.core.model.auth.PrincipalKind;
import dockhand.core.model.auth.WebhookContext;
import dockhand.core.port.in.WebhookAuthentication;
import dockhand.core.port.out.AuthMetrics;

/**
 * Authenticates inbound partner webhooks by API key only.
 *
 * <p>Accepts the configured webhook header aliases in order and never falls back
 * to a bearer token.
 */
@ApplicationScoped
public class WebhookCredentialResolver implements WebhookAuthentication {

    private static final Logger LOG = Logger.getLogger(WebhookCredentialResolver.class);

    private final ApiKeyVerifier keyVerifier;
    private final UsageMeteringService metering;
    private final ApiKeyConfig config;
    private final AuthMetrics metrics;

    @Inject
    public WebhookCredentialResolver(
            ApiKeyVerifier keyVerifier, UsageMeteringService metering, ApiKeyConfig config, AuthMetrics metrics) {
        this.keyVerifier = keyVerifier;
        this.metering = metering;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<WebhookContext> authenticate(CredentialHeaders headers) {
        var rawKey = headers.firstOf(config.webhookHeaderAliases());
        if (rawKey.isEmpty()) {
            var failure = new AuthenticationException(
                    AuthenticationFailure.MISSING_CREDENTIAL,
                    "Webhook authentication required",
                    String.join(" or ", config.webhookHeaderAliases()) + ": <key>");
            metrics.recordAuthFailure(failure.failure());
            return Uni.createFrom().failure(failure);
        }

        return keyVerifier
                .verify(rawKey.get())
                .invoke(key -> metering.recordUse(key.id()))
                .map(key -> {
                    String source = key.scope().courier().orElse(key.name());
                    LOG.debugf("Webhook authenticated: source=%s, keyId=%s", source, key.id());
                    metrics.recordAuthSuccess(PrincipalKind.MACHINE);
                    return new WebhookContext(source, key.id(), Instant.now());
                })
                .onFailure(AuthenticationException.class)
                .invoke(e -> metrics.recordAuthFailure(((AuthenticationException) e).failure()));
    }
}
