package dockhand.spi;

import dockhand.core.port.out.ApiKeyRepository;

/**
 * Service Provider Interface for API key storage implementations.
 *
 * <p>Implementations are discovered via java.util.ServiceLoader at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/dockhand.spi.ApiKeyStorageProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: dockhand.auth.storage.provider=your-provider-name</li>
 * </ol>
 *
 * <p>Repositories must implement {@link ApiKeyRepository#incrementUsage} as an
 * in-place atomic update and must remember the hashes of deleted keys.
 */
public interface ApiKeyStorageProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: dockhand.auth.storage.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " API key storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority. The built-in memory provider uses 0.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (dependencies present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the repository implementation.
     *
     * <p>Called once at startup. The returned instance must be thread-safe.
     *
     * @param config Access to configuration properties
     * @return Repository implementation
     * @throws StorageProviderException if initialization fails
     */
    ApiKeyRepository createRepository(StorageAdapterConfig config);
}
