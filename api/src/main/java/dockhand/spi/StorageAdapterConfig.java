package dockhand.spi;

import java.util.Optional;

/**
 * Configuration access for storage providers.
 *
 * <p>Providers use this to read their configuration without coupling
 * to a specific configuration framework.
 */
public interface StorageAdapterConfig {

    /**
     * Get a required configuration value.
     *
     * @param key The configuration key
     * @return The configuration value
     * @throws IllegalStateException if not configured
     */
    String getRequired(String key);

    /**
     * Get an optional configuration value.
     *
     * @param key The configuration key
     * @return Optional containing the value if present
     */
    Optional<String> get(String key);

    /**
     * Get configuration value with default.
     */
    String getOrDefault(String key, String defaultValue);
}
