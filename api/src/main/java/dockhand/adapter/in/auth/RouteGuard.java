package dockhand.adapter.in.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.AuthScheme;
import dockhand.core.model.auth.CredentialHeaders;
import dockhand.core.model.auth.Principal;
import dockhand.core.model.auth.RouteRequirement;
import dockhand.core.model.auth.WebhookContext;
import dockhand.core.port.in.CredentialResolution;
import dockhand.core.port.in.WebhookAuthentication;
import dockhand.core.service.auth.AuthorizationService;

/**
 * Resolves and authorizes the caller of a REST endpoint.
 *
 * <p>Resources call this first and receive the principal explicitly; nothing is
 * stashed on the request.
 */
@ApplicationScoped
public class RouteGuard {

    private final CredentialResolution resolver;
    private final WebhookAuthentication webhookAuthentication;
    private final AuthorizationService authorization;

    @Inject
    public RouteGuard(
            CredentialResolution resolver,
            WebhookAuthentication webhookAuthentication,
            AuthorizationService authorization) {
        this.resolver = resolver;
        this.webhookAuthentication = webhookAuthentication;
        this.authorization = authorization;
    }

    /**
     * Resolve the caller and check it against a route that does not target courier-owned data.
     */
    public Uni<Principal> require(HttpHeaders headers, AuthScheme scheme, RouteRequirement requirement) {
        return resolver.resolve(credentialHeaders(headers), scheme)
                .invoke(principal -> authorization.authorize(principal, requirement));
    }

    /**
     * Resolve the caller without authorizing, for routes that must load a resource
     * before the scope check.
     */
    public Uni<Principal> resolve(HttpHeaders headers, AuthScheme scheme) {
        return resolver.resolve(credentialHeaders(headers), scheme);
    }

    public Uni<WebhookContext> webhook(HttpHeaders headers) {
        return webhookAuthentication.authenticate(credentialHeaders(headers));
    }

    static CredentialHeaders credentialHeaders(HttpHeaders headers) {
        return headers == null ? CredentialHeaders.empty() : CredentialHeaders.of(headers.getRequestHeaders());
    }
}
