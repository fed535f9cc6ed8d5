package dockhand.core.model.auth;

import java.util.List;
import java.util.Map;

/**
 * Non-secret integration metadata used to configure the partner's portal.
 *
 * @param partnerName      display name of the logistics partner
 * @param portalUrl        partner portal address, if configured
 * @param baseUrl          public base URL of this service
 * @param acceptedHeaders  header names accepted for API key credentials
 * @param endpoints        partner-callable endpoints by operation name
 * @param webhookEndpoints webhook endpoints by event name
 * @param activeKeyCount   keys that would currently authenticate
 * @param activeKeys       summaries of those keys
 */
public record ConnectionInfo(
        String partnerName,
        String portalUrl,
        String baseUrl,
        List<String> acceptedHeaders,
        Map<String, String> endpoints,
        Map<String, String> webhookEndpoints,
        int activeKeyCount,
        List<ApiKeyView> activeKeys) {

    public boolean hasActiveKey() {
        return activeKeyCount > 0;
    }
}
