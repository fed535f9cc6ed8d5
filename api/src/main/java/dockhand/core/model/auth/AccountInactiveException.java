package dockhand.core.model.auth;

/**
 * The session token was valid but the referenced account is not active.
 *
 * <p>Kept apart from {@link AuthenticationException} so clients can tell that the
 * credential itself was fine.
 */
public class AccountInactiveException extends RuntimeException {

    private final String userId;
    private final AccountStatus status;

    public AccountInactiveException(String userId, AccountStatus status) {
        super("Account %s is %s. Contact support to activate it."
                .formatted(userId, status.name().toLowerCase(java.util.Locale.ROOT)));
        this.userId = userId;
        this.status = status;
    }

    public String userId() {
        return userId;
    }

    public AccountStatus status() {
        return status;
    }
}
