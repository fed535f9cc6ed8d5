package dockhand.core.model.auth;

/**
 * A generated key collided with a live or previously deleted key. Callers may retry.
 */
public class DuplicateKeyException extends RuntimeException {

    public DuplicateKeyException(String message) {
        super(message);
    }
}
