package dockhand.adapter.out.storage.memory;

import dockhand.core.port.out.ApiKeyRepository;
import dockhand.spi.ApiKeyStorageProvider;
import dockhand.spi.StorageAdapterConfig;

/**
 * In-memory storage provider for API keys.
 *
 * <p>Data is NOT persisted across application restarts.
 */
public class InMemoryApiKeyStorageProvider implements ApiKeyStorageProvider {

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory API key storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public ApiKeyRepository createRepository(StorageAdapterConfig config) {
        return new InMemoryApiKeyRepository();
    }
}
