package dockhand.core.port.in;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.AuthScheme;
import dockhand.core.model.auth.CredentialHeaders;
import dockhand.core.model.auth.Principal;

/**
 * Port for turning request headers into a {@link Principal}.
 */
public interface CredentialResolution {

    /**
     * Resolves the caller using the schemes a route accepts.
     *
     * <p>In {@link AuthScheme#COMBINED} mode a present API key header always wins over a
     * bearer header. A successful API key resolution schedules exactly one usage
     * update, whatever the later authorization outcome.
     *
     * @param headers the request headers
     * @param scheme  accepted schemes
     * @return Uni with the principal, or failing with
     *         {@link dockhand.core.model.auth.AuthenticationException} or
     *         {@link dockhand.core.model.auth.AccountInactiveException}
     */
    Uni<Principal> resolve(CredentialHeaders headers, AuthScheme scheme);
}
