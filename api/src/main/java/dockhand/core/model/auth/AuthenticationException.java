package dockhand.core.model.auth;

/**
 * A request's credential could not be resolved to a principal.
 *
 * <p>Never retried. The hint tells the caller which header or scheme to use, or
 * where to obtain a new key.
 */
public class AuthenticationException extends RuntimeException {

    private final AuthenticationFailure failure;
    private final String hint;

    public AuthenticationException(AuthenticationFailure failure, String message, String hint) {
        super(message);
        this.failure = failure;
        this.hint = hint;
    }

    public AuthenticationFailure failure() {
        return failure;
    }

    public String hint() {
        return hint;
    }
}
