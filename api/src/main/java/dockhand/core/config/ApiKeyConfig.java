package dockhand.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for API key issuance and header handling.
 *
 * <h2>Example</h2>
 * <pre>
 * dockhand.auth.api-keys.header=X-API-Key
 * dockhand.auth.api-keys.header-aliases=X-KCD-API-Key
 * dockhand.auth.api-keys.default-ttl=P365D
 * dockhand.auth.api-keys.max-ttl=P730D
 * </pre>
 */
@ConfigMapping(prefix = "dockhand.auth.api-keys")
public interface ApiKeyConfig {

    /**
     * Canonical header carrying an API key.
     */
    @WithDefault("X-API-Key")
    String header();

    /**
     * Additional header names accepted for first-party API clients.
     */
    @WithDefault("X-KCD-API-Key")
    List<String> headerAliases();

    /**
     * Header names accepted from webhook senders, tried in order.
     */
    @WithDefault("X-KCD-API-Key,X-API-Key,X-Webhook-Key")
    List<String> webhookHeaderAliases();

    /**
     * Lifetime applied when an issue request does not name one. Empty means keys never expire.
     */
    Optional<Duration> defaultTtl();

    /**
     * Upper bound on a requested lifetime.
     */
    Optional<Duration> maxTtl();

    /**
     * Permissions granted when an issue request does not list any.
     */
    @WithDefault("kcd_integration")
    Set<String> defaultPermissions();

    /**
     * Accepted courier code format, checked after upper-casing.
     */
    @WithDefault("^[A-Z0-9][A-Z0-9_-]{1,19}$")
    String courierCodePattern();

    /**
     * Accepted warehouse reference format.
     */
    @WithDefault("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$")
    String warehouseIdPattern();

    /**
     * Leading word of derived key names, e.g. {@code KCD ACME Integration}.
     */
    @WithDefault("KCD")
    String keyNamePrefix();
}
