package dockhand.core.model.auth;

/**
 * The current state of a user account, re-loaded on every session resolution.
 *
 * @param id     the user id asserted by the session token
 * @param email  contact address, used only for logging
 * @param role   the user's role
 * @param status the account status
 */
public record UserAccount(String id, String email, UserRole role, AccountStatus status) {

    public UserAccount {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (status == null) {
            status = AccountStatus.PENDING;
        }
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
