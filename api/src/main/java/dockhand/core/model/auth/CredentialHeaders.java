package dockhand.core.model.auth;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Case-insensitive snapshot of the request headers relevant to authentication.
 *
 * <p>Header lookups return {@link Optional#empty()} for absent headers. A header
 * that is present but blank is returned as an empty string so callers can tell
 * "missing" apart from "malformed".
 */
public final class CredentialHeaders {

    public static final String AUTHORIZATION = "Authorization";

    private static final String BEARER = "bearer ";

    private final Map<String, String> values;

    private CredentialHeaders(Map<String, String> values) {
        this.values = values;
    }

    /**
     * Builds a snapshot from a multi-valued header map. The first value of each header wins.
     */
    public static CredentialHeaders of(Map<String, ? extends List<String>> headers) {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, list) -> {
                if (name != null && list != null && !list.isEmpty() && list.get(0) != null) {
                    normalized.putIfAbsent(name.toLowerCase(Locale.ROOT), list.get(0).trim());
                }
            });
        }
        return new CredentialHeaders(normalized);
    }

    /**
     * Builds a snapshot from single-valued headers.
     */
    public static CredentialHeaders ofSingle(Map<String, String> headers) {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    normalized.putIfAbsent(name.toLowerCase(Locale.ROOT), value.trim());
                }
            });
        }
        return new CredentialHeaders(normalized);
    }

    public static CredentialHeaders empty() {
        return new CredentialHeaders(Map.of());
    }

    /**
     * Returns the value of a header, matched case-insensitively.
     */
    public Optional<String> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the first header present among {@code names}, in order.
     */
    public Optional<String> firstOf(Collection<String> names) {
        for (String name : names) {
            Optional<String> value = get(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Whether any of {@code names} is present.
     */
    public boolean hasAny(Collection<String> names) {
        return firstOf(names).isPresent();
    }

    /**
     * Returns the Authorization header value, if present.
     */
    public Optional<String> authorization() {
        return get(AUTHORIZATION);
    }

    /**
     * Extracts the token from an Authorization header value.
     *
     * <p>The {@code Bearer} prefix is optional and matched case-insensitively. A doubled
     * prefix ({@code Bearer Bearer x}) is collapsed. Returns empty when no token remains.
     *
     * @param headerValue the raw Authorization header value
     * @return the token
     */
    public static Optional<String> bearerToken(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        String token = stripBearer(headerValue.trim());
        token = stripBearer(token);
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private static String stripBearer(String value) {
        if (value.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return value.substring(BEARER.length()).trim();
        }
        if (value.equalsIgnoreCase(BEARER.trim())) {
            return "";
        }
        return value;
    }
}
