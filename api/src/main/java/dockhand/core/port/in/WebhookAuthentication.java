package dockhand.core.port.in;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.CredentialHeaders;
import dockhand.core.model.auth.WebhookContext;

/**
 * Port for authenticating inbound webhook calls.
 *
 * <p>Only API key headers are accepted. There is no bearer-token fallback.
 */
public interface WebhookAuthentication {

    /**
     * @param headers the request headers
     * @return Uni with the webhook context, or failing with
     *         {@link dockhand.core.model.auth.AuthenticationException}
     */
    Uni<WebhookContext> authenticate(CredentialHeaders headers);
}
