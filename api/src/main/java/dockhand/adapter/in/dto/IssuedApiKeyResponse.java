package dockhand.adapter.in.dto;

import java.util.List;

/**
 * Response to a successful issuance. The only place the raw key ever appears.
 *
 * @param apiKey    the raw key; it cannot be retrieved again
 * @param key       the stored key's metadata
 * @param nextSteps instructions for configuring the partner
 */
public record IssuedApiKeyResponse(String apiKey, ApiKeyResponse key, List<String> nextSteps) {}
