package dockhand.core.model.auth;

/**
 * Per-key request budget consumed by an external throttling component.
 *
 * <p>This layer only stores and exposes the numbers; it never throttles.
 *
 * @param perMinute requests allowed per minute
 * @param perHour   requests allowed per hour
 * @param perDay    requests allowed per day
 */
public record RateLimitPolicy(int perMinute, int perHour, int perDay) {

    public static final int DEFAULT_PER_MINUTE = 60;
    public static final int DEFAULT_PER_HOUR = 1000;
    public static final int DEFAULT_PER_DAY = 10000;

    public RateLimitPolicy {
        if (perMinute < 1 || perHour < 1 || perDay < 1) {
            throw new IllegalArgumentException("Rate limits must be at least 1 request per window");
        }
    }

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(DEFAULT_PER_MINUTE, DEFAULT_PER_HOUR, DEFAULT_PER_DAY);
    }

    /**
     * Builds a policy where missing values fall back to the defaults.
     */
    public static RateLimitPolicy of(Integer perMinute, Integer perHour, Integer perDay) {
        return new RateLimitPolicy(
                perMinute != null ? perMinute : DEFAULT_PER_MINUTE,
                perHour != null ? perHour : DEFAULT_PER_HOUR,
                perDay != null ? perDay : DEFAULT_PER_DAY);
    }
}
