package dockhand.core.model.auth;

/**
 * Capability tokens granted to API keys.
 */
public final class Permissions {

    private Permissions() {}

    public static final String PACKAGES_READ = "packages:read";
    public static final String PACKAGES_WRITE = "packages:write";
    public static final String CUSTOMERS_READ = "customers:read";
    public static final String MANIFESTS_WRITE = "manifests:write";

    /** Granted to keys issued for the logistics partner portal. */
    public static final String PARTNER_INTEGRATION = "kcd_integration";

    /** Granted to keys used by webhook senders. */
    public static final String WEBHOOK = "webhook";
}
