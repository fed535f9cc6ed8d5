package dockhand.core.model.auth;

/**
 * An administrative operation named a key id that does not exist.
 */
public class ApiKeyNotFoundException extends RuntimeException {

    private final String keyId;

    public ApiKeyNotFoundException(String keyId) {
        super("API key not found: " + keyId);
        this.keyId = keyId;
    }

    public String keyId() {
        return keyId;
    }
}
