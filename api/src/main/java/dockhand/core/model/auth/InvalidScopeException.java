package dockhand.core.model.auth;

/**
 * A courier code or warehouse reference supplied at issuance did not validate.
 */
public class InvalidScopeException extends RuntimeException {

    public InvalidScopeException(String message) {
        super(message);
    }
}
