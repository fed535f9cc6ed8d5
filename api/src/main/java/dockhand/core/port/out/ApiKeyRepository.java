package dockhand.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.ApiKeyRecord;

/**
 * Port interface for durable storage of API keys.
 *
 * <p>Writes are targeted: toggling a key or recording usage never rewrites the
 * whole record, so concurrent administrative changes and usage increments do not
 * overwrite each other.
 */
public interface ApiKeyRepository {

    /**
     * Insert a newly issued key.
     *
     * <p>Fails the insert (returns false) when the key hash belongs to a live key or
     * to any key that was ever deleted, so raw values are never reused.
     *
     * @param apiKey the key to persist
     * @return Uni with true if stored, false on hash collision
     */
    Uni<Boolean> insert(ApiKeyRecord apiKey);

    /**
     * Find a key by id.
     */
    Uni<Optional<ApiKeyRecord>> findById(String keyId);

    /**
     * Find a key by the SHA-256 digest of its raw value.
     */
    Uni<Optional<ApiKeyRecord>> findByKeyHash(String keyHash);

    /**
     * Retrieve all keys.
     */
    Uni<List<ApiKeyRecord>> findAll();

    /**
     * Set the active flag and {@code updatedAt}, leaving every other field untouched.
     *
     * @param keyId  the key id
     * @param active the new flag value
     * @param now    the update time
     * @return Uni with the updated record, empty if no such key
     */
    Uni<Optional<ApiKeyRecord>> setActive(String keyId, boolean active, Instant now);

    /**
     * Atomically add one to {@code usageCount} and set {@code lastUsedAt}.
     *
     * <p>Must be an in-place increment at the storage layer: concurrent calls for the
     * same key must never lose an increment.
     *
     * @param keyId  the key id
     * @param usedAt the time of use
     * @return Uni with true if the key existed
     */
    Uni<Boolean> incrementUsage(String keyId, Instant usedAt);

    /**
     * Permanently delete a key.
     *
     * @return Uni with the deleted record, empty if not found
     */
    Uni<Optional<ApiKeyRecord>> delete(String keyId);
}
