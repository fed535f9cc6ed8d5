package dockhand.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for API key usage metering.
 *
 * <p>Configuration prefix: {@code dockhand.auth.metering}
 */
@ConfigMapping(prefix = "dockhand.auth.metering")
public interface MeteringConfig {

    /**
     * Record usage counters on successful key resolution.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Maximum time a single counter write may take before it is abandoned and logged.
     */
    @WithDefault("PT5S")
    Duration writeTimeout();

    /**
     * Time allowed for queued writes to drain on shutdown.
     */
    @WithDefault("PT10S")
    Duration shutdownGracePeriod();
}
