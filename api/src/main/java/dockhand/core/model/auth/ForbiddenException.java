package dockhand.core.model.auth;

/**
 * A resolved principal may not use the route.
 *
 * <p>Always states what the route required and what the principal had.
 */
public class ForbiddenException extends RuntimeException {

    /**
     * Sub-kinds of authorization failure.
     */
    public enum Kind {
        FORBIDDEN("forbidden"),
        SCOPE_MISMATCH("scope_mismatch");

        private final String code;

        Kind(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Kind kind;
    private final String required;
    private final String actual;

    public ForbiddenException(Kind kind, String message, String required, String actual) {
        super(message);
        this.kind = kind;
        this.required = required;
        this.actual = actual;
    }

    public Kind kind() {
        return kind;
    }

    public String required() {
        return required;
    }

    public String actual() {
        return actual;
    }
}
