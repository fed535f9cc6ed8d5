package dockhand.core.model.auth;

/**
 * The credential population a {@link Principal} was resolved from.
 */
public enum PrincipalKind {
    /** Interactive staff, admin or customer user holding a signed session token. */
    HUMAN,

    /** Partner integration calling with an API key. */
    MACHINE
}
