package dockhand.adapter.in.dto;

import java.util.List;
import java.util.Map;

import dockhand.core.model.auth.ConnectionInfo;

/**
 * Integration metadata for the partner portal. Contains no key material.
 */
public record ConnectionInfoResponse(
        String partnerName,
        String portalUrl,
        String baseUrl,
        List<String> acceptedHeaders,
        Map<String, String> endpoints,
        Map<String, String> webhookEndpoints,
        boolean hasActiveKey,
        int activeKeyCount,
        List<ApiKeyResponse> activeKeys) {

    public static ConnectionInfoResponse fromModel(ConnectionInfo info) {
        return new ConnectionInfoResponse(
                info.partnerName(),
                info.portalUrl(),
                info.baseUrl(),
                info.acceptedHeaders(),
                info.endpoints(),
                info.webhookEndpoints(),
                info.hasActiveKey(),
                info.activeKeyCount(),
                info.activeKeys().stream().map(ApiKeyResponse::fromModel).toList());
    }
}
