package dockhand.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dockhand.core.model.auth.ApiKeyRecord;
import dockhand.core.model.auth.CredentialScope;

@DisplayName("InMemoryApiKeyRepository")
class InMemoryApiKeyRepositoryTest {

    private InMemoryApiKeyRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryApiKeyRepository();
    }

    private static ApiKeyRecord key(String id, String hash) {
        return ApiKeyRecord.builder(id, hash)
                .ownerRef("admin-1")
                .scope(CredentialScope.courier("ACME"))
                .build();
    }

    @Nested
    @DisplayName("insert")
    class Insert {

        @Test
        @DisplayName("should find a stored key by id and hash")
        void findsStored() {
            assertTrue(repository.insert(key("k1", "h1")).await().indefinitely());

            assertEquals("k1", repository.findByKeyHash("h1").await().indefinitely().orElseThrow().id());
            assertTrue(repository.findById("k1").await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should refuse a live hash")
        void refusesLiveHash() {
            repository.insert(key("k1", "h1")).await().indefinitely();

            assertFalse(repository.insert(key("k2", "h1")).await().indefinitely());
        }

        @Test
        @DisplayName("should refuse a hash that belonged to a deleted key")
        void refusesRetiredHash() {
            repository.insert(key("k1", "h1")).await().indefinitely();
            repository.delete("k1").await().indefinitely();

            assertFalse(repository.insert(key("k2", "h1")).await().indefinitely());
            assertTrue(repository.findByKeyHash("h1").await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("targeted writes")
    class TargetedWrites {

        @Test
        @DisplayName("setActive should be visible through the hash lookup")
        void setActiveVisibleByHash() {
            repository.insert(key("k1", "h1")).await().indefinitely();

            repository.setActive("k1", false, Instant.now()).await().indefinitely();

            assertFalse(repository.findByKeyHash("h1").await().indefinitely().orElseThrow().active());
        }

        @Test
        @DisplayName("setActive on an unknown key should return empty")
        void setActiveUnknown() {
            assertTrue(repository.setActive("nope", true, Instant.now()).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("incrementUsage on an unknown key should return false")
        void incrementUnknown() {
            assertFalse(repository.incrementUsage("nope", Instant.now()).await().indefinitely());
        }

        @Test
        @DisplayName("concurrent increments and toggles should not overwrite each other")
        void concurrentIncrementsAndToggles() {
            repository.insert(key("k1", "h1")).await().indefinitely();
            ExecutorService pool = Executors.newFixedThreadPool(8);
            List<CompletableFuture<?>> futures = new ArrayList<>();

            for (int i = 0; i < 1000; i++) {
                final boolean active = i % 2 == 0;
                futures.add(CompletableFuture.runAsync(
                        () -> repository.incrementUsage("k1", Instant.now()).await().indefinitely(), pool));
                if (i % 10 == 0) {
                    futures.add(CompletableFuture.runAsync(
                            () -> repository.setActive("k1", active, Instant.now()).await().indefinitely(), pool));
                }
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            pool.shutdown();

            assertEquals(1000, repository.findById("k1").await().indefinitely().orElseThrow().usageCount());
        }
    }
}
