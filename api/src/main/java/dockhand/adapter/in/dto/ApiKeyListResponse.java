package dockhand.adapter.in.dto;

import java.util.List;

/**
 * Filtered key listing with counts.
 *
 * @param keys   matching keys, newest first
 * @param total  number of matching keys
 * @param active number of matching keys that would currently authenticate
 */
public record ApiKeyListResponse(List<ApiKeyResponse> keys, int total, long active) {

    public static ApiKeyListResponse of(List<ApiKeyResponse> keys) {
        long usable = keys.stream().filter(k -> k.active() && !k.expired()).count();
        return new ApiKeyListResponse(keys, keys.size(), usable);
    }
}
