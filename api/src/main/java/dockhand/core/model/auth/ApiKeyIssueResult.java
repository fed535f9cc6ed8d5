package dockhand.core.model.auth;

/**
 * Result of issuing an API key.
 *
 * <p>This is the only place the raw key ever appears. Every other read path
 * returns an {@link ApiKeyView}.
 *
 * @param rawKey the generated key, shown once
 * @param key    the stored key without secret material
 */
public record ApiKeyIssueResult(String rawKey, ApiKeyView key) {

    public ApiKeyIssueResult {
        if (rawKey == null || rawKey.isBlank()) {
            throw new IllegalArgumentException("Raw key cannot be null or blank");
        }
        if (key == null) {
            throw new IllegalArgumentException("Key metadata cannot be null");
        }
    }

    @Override
    public String toString() {
        return "ApiKeyIssueResult[key=" + key.id() + "]";
    }
}
