package dockhand.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for signed session tokens presented by human users.
 *
 * <p>Configuration prefix: {@code dockhand.auth.session}
 */
@ConfigMapping(prefix = "dockhand.auth.session")
public interface SessionConfig {

    /**
     * HMAC secret shared with the login service. Must be at least 32 bytes.
     */
    String secret();

    /**
     * Expected {@code iss} claim.
     */
    @WithDefault("dockhand")
    String issuer();

    /**
     * Lifetime of tokens minted by this service.
     */
    @WithDefault("P7D")
    Duration ttl();

    /**
     * Tolerated clock difference when checking {@code exp}.
     */
    @WithDefault("PT30S")
    Duration clockSkew();
}
