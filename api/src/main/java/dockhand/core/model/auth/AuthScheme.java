package dockhand.core.model.auth;

/**
 * Which credential schemes a route accepts.
 */
public enum AuthScheme {
    /** API key header only. */
    API_KEY,

    /** Bearer session token only. */
    SESSION,

    /** API key header when present, else bearer session token. */
    COMBINED
}
