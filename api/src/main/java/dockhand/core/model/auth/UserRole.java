package dockhand.core.model.auth;

import java.util.Locale;

/**
 * Roles carried by human principals.
 *
 * <p>Roles are matched by exact membership. There is no hierarchy: {@code admin}
 * does not satisfy a route that only admits {@code customer}.
 */
public enum UserRole {
    ADMIN("admin"),
    WAREHOUSE_STAFF("warehouse_staff"),
    CUSTOMER("customer");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a stored role name.
     *
     * <p>Accepts the legacy name {@code warehouse} for {@link #WAREHOUSE_STAFF}.
     *
     * @param value the stored role name
     * @return the matching role
     * @throws IllegalArgumentException if the name is unknown
     */
    public static UserRole fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("warehouse".equals(normalized)) {
            return WAREHOUSE_STAFF;
        }
        for (UserRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
