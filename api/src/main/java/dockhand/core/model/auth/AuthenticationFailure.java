package dockhand.core.model.auth;

/**
 * Reasons a credential could not be resolved. All surface as 401.
 */
public enum AuthenticationFailure {
    MISSING_CREDENTIAL("missing_credential"),
    MALFORMED_CREDENTIAL("malformed_credential"),
    CREDENTIAL_NOT_FOUND("credential_not_found"),
    CREDENTIAL_INACTIVE("credential_inactive"),
    CREDENTIAL_EXPIRED("credential_expired"),
    SESSION_INVALID("session_invalid"),
    SESSION_EXPIRED("session_expired");

    private final String code;

    AuthenticationFailure(String code) {
        this.code = code;
    }

    /**
     * Stable machine-readable code used in responses and metrics.
     */
    public String code() {
        return code;
    }
}
