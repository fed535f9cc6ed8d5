package dockhand.adapter.in.dto;

import dockhand.core.model.auth.RateLimitPolicy;

/**
 * Request budget attached to an API key. Missing values take the defaults (60/1000/10000).
 */
public record RateLimitDto(Integer requestsPerMinute, Integer requestsPerHour, Integer requestsPerDay) {

    public RateLimitPolicy toModel() {
        return RateLimitPolicy.of(requestsPerMinute, requestsPerHour, requestsPerDay);
    }

    public static RateLimitDto fromModel(RateLimitPolicy policy) {
        if (policy == null) {
            return null;
        }
        return new RateLimitDto(policy.perMinute(), policy.perHour(), policy.perDay());
    }
}
