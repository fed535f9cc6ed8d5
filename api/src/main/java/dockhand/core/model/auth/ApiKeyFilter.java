package dockhand.core.model.auth;

/**
 * Criteria for listing API keys. Null fields match everything.
 */
public record ApiKeyFilter(String courierCode, String warehouseId, Boolean active) {

    public static ApiKeyFilter all() {
        return new ApiKeyFilter(null, null, null);
    }

    public boolean matches(ApiKeyRecord key) {
        if (courierCode != null && !courierCode.equalsIgnoreCase(key.scope().courierCode())) {
            return false;
        }
        if (warehouseId != null && !warehouseId.equals(key.scope().warehouseId())) {
            return false;
        }
        return active == null || active == key.active();
    }
}
