package dockhand.core.model.auth;

/**
 * Status of a user account referenced by a session token.
 */
public enum AccountStatus {
    PENDING,
    ACTIVE,
    INACTIVE
}
