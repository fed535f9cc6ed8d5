package dockhand.adapter.out.storage.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.ApiKeyRecord;
import dockhand.core.port.out.ApiKeyRepository;

/**
 * In-memory implementation of ApiKeyRepository.
 *
 * <p>Data is NOT persisted across restarts. Suitable for development, testing and
 * single-instance deployments.
 *
 * <p>Thread-safety: insert and delete hold a write lock to keep the id map, the
 * hash index and the retired hash set consistent. Toggles and usage increments
 * are per-key atomic updates through {@link ConcurrentHashMap#computeIfPresent}.
 *
 * <p>This class is instantiated by {@link InMemoryApiKeyStorageProvider}.
 */
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final ConcurrentHashMap<String, ApiKeyRecord> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> idByHash = new ConcurrentHashMap<>();
    private final Set<String> retiredHashes = ConcurrentHashMap.newKeySet();
    private final Object writeLock = new Object();

    @Override
    public Uni<Boolean> insert(ApiKeyRecord apiKey) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                if (idByHash.containsKey(apiKey.keyHash())
                        || retiredHashes.contains(apiKey.keyHash())
                        || storageById.containsKey(apiKey.id())) {
                    return false;
                }
                storageById.put(apiKey.id(), apiKey);
                idByHash.put(apiKey.keyHash(), apiKey.id());
                return true;
            }
        });
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> findById(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(keyId)));
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> findByKeyHash(String keyHash) {
        return Uni.createFrom().item(() -> Optional.ofNullable(idByHash.get(keyHash)).map(storageById::get));
    }

    @Override
    public Uni<List<ApiKeyRecord>> findAll() {
        return Uni.createFrom().item(() -> new ArrayList<>(storageById.values()));
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> setActive(String keyId, boolean active, Instant now) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(
                        storageById.computeIfPresent(keyId, (id, existing) -> existing.withActive(active, now))));
    }

    @Override
    public Uni<Boolean> incrementUsage(String keyId, Instant usedAt) {
        return Uni.createFrom()
                .item(() -> storageById.computeIfPresent(keyId, (id, existing) -> existing.withUsage(usedAt)) != null);
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> delete(String keyId) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                var apiKey = storageById.remove(keyId);
                if (apiKey == null) {
                    return Optional.<ApiKeyRecord>empty();
                }
                idByHash.remove(apiKey.keyHash());
                retiredHashes.add(apiKey.keyHash());
                return Optional.of(apiKey);
            }
        });
    }
}
