package dockhand.core.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Describes the endpoints a logistics partner is configured with.
 *
 * <p>Configuration prefix: {@code dockhand.integration}
 */
@ConfigMapping(prefix = "dockhand.integration")
public interface IntegrationConfig {

    /**
     * Public base URL of this service. Falls back to the request's base URI.
     */
    Optional<String> baseUrl();

    /**
     * Partner portal where keys and endpoint URLs are entered.
     */
    Optional<String> portalUrl();

    /**
     * Display name of the partner.
     */
    @WithDefault("KCD Logistics")
    String partnerName();

    /**
     * Partner-callable endpoints, keyed by operation name, relative to the base URL.
     *
     * <pre>
     * dockhand.integration.endpoints.packageLookup=/api/partner/packages/{trackingNumber}
     * </pre>
     */
    Map<String, String> endpoints();

    /**
     * Webhook endpoints, keyed by event name, relative to the base URL.
     */
    Map<String, String> webhooks();
}
