package dockhand.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Example configuration:
 * <pre>{@code
 * dockhand.telemetry.enabled=true
 * dockhand.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "dockhand.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         * Requires dockhand.telemetry.enabled=true to take effect.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
