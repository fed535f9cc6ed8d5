package dockhand.core.model.auth;

import java.util.Optional;

/**
 * Narrows which business records a credential may touch.
 *
 * <p>A key is scoped to a courier code, a warehouse, or both. An unscoped value
 * is only used for human principals.
 *
 * @param courierCode upper-case courier code, or null
 * @param warehouseId warehouse reference, or null
 */
public record CredentialScope(String courierCode, String warehouseId) {

    private static final CredentialScope UNSCOPED = new CredentialScope(null, null);

    public CredentialScope {
        if (courierCode != null && courierCode.isBlank()) {
            courierCode = null;
        }
        if (warehouseId != null && warehouseId.isBlank()) {
            warehouseId = null;
        }
    }

    public static CredentialScope unscoped() {
        return UNSCOPED;
    }

    public static CredentialScope courier(String courierCode) {
        return new CredentialScope(courierCode, null);
    }

    public static CredentialScope warehouse(String warehouseId) {
        return new CredentialScope(null, warehouseId);
    }

    public Optional<String> courier() {
        return Optional.ofNullable(courierCode);
    }

    public Optional<String> warehouse() {
        return Optional.ofNullable(warehouseId);
    }

    public boolean isEmpty() {
        return courierCode == null && warehouseId == null;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "unscoped";
        }
        var sb = new StringBuilder();
        if (courierCode != null) {
            sb.append("courier=").append(courierCode);
        }
        if (warehouseId != null) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append("warehouse=").append(warehouseId);
        }
        return sb.toString();
    }
}
