package dockhand.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dockhand.core.port.out.ApiKeyRepository;
import dockhand.spi.ApiKeyStorageProvider;
import dockhand.spi.StorageAdapterConfig;
import dockhand.spi.StorageProviderException;

/**
 * Discovers and loads API key storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If dockhand.auth.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class ApiKeyStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(ApiKeyStorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageAdapterConfig config;

    @Inject
    public ApiKeyStorageProviderLoader(
            @ConfigProperty(name = "dockhand.auth.storage.provider") Optional<String> configuredProvider,
            StorageAdapterConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public ApiKeyRepository apiKeyRepository() {
        ApiKeyStorageProvider provider = selectProvider(discover());
        LOG.infof("Creating API key repository from provider: %s (%s)", provider.name(), provider.description());
        return provider.createRepository(config);
    }

    List<ApiKeyStorageProvider> discover() {
        List<ApiKeyStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(ApiKeyStorageProvider.class).forEach(providers::add);
        return providers;
    }

    ApiKeyStorageProvider selectProvider(List<ApiKeyStorageProvider> providers) {
        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No API key storage providers found. Ensure a provider JAR is on the classpath.");
        }

        LOG.infof(
                "Found %d API key storage provider(s): %s",
                providers.size(),
                providers.stream().map(ApiKeyStorageProvider::name).toList());

        String configured = configuredProvider.orElse(null);
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(ApiKeyStorageProvider::name).toList()));
        }

        return providers.stream()
                .filter(ApiKeyStorageProvider::isAvailable)
                .max(Comparator.comparingInt(ApiKeyStorageProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available storage providers"));
    }
}
