package dockhand.core.service.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import dockhand.core.config.MeteringConfig;
import dockhand.core.port.out.ApiKeyRepository;
import dockhand.core.port.out.AuthMetrics;

/**
 * Records API key usage without delaying the request.
 *
 * <p>{@link #recordUse} enqueues the write before returning and never throws. A
 * dedicated worker applies the atomic increment; a failed write is logged and
 * counted, never surfaced to the caller. A write that times out is counted as
 * unconfirmed, not failed, since the storage may still apply it. Queued writes are drained on shutdown
 * for up to the configured grace period.
 */
@ApplicationScoped
public class UsageMeteringService {

    private static final Logger LOG = Logger.getLogger(UsageMeteringService.class);

    private final ApiKeyRepository repository;
    private final AuthMetrics metrics;
    private final MeteringConfig config;
    private final ExecutorService executor;

    @Inject
    public UsageMeteringService(ApiKeyRepository repository, AuthMetrics metrics, MeteringConfig config) {
        this(repository, metrics, config, newWorker());
    }

    UsageMeteringService(
            ApiKeyRepository repository, AuthMetrics metrics, MeteringConfig config, ExecutorService executor) {
        this.repository = repository;
        this.metrics = metrics;
        this.config = config;
        this.executor = executor;
    }

    private static ExecutorService newWorker() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "apikey-usage-metering");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queue one usage increment for a key.
     *
     * @param keyId the key that authenticated the request
     */
    public void recordUse(String keyId) {
        if (!config.enabled()) {
            return;
        }
        Instant usedAt = Instant.now();
        try {
            executor.execute(() -> write(keyId, usedAt));
        } catch (RejectedExecutionException e) {
            LOG.warnf("Usage for API key %s dropped: metering worker is shut down", keyId);
            metrics.recordUsageFailure();
        }
    }

    private void write(String keyId, Instant usedAt) {
        try {
            Boolean found = repository.incrementUsage(keyId, usedAt).await().atMost(config.writeTimeout());
            if (Boolean.TRUE.equals(found)) {
                metrics.recordUsageRecorded();
            } else {
                LOG.debugf("API key %s was deleted before its usage was recorded", keyId);
            }
        } catch (io.smallrye.mutiny.TimeoutException e) {
            LOG.warnf(
                    "Usage for API key %s not confirmed within %s; the increment may still apply",
                    keyId, config.writeTimeout());
            metrics.recordUsageUnconfirmed();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to record usage for API key %s", keyId);
            metrics.recordUsageFailure();
        }
    }

    /**
     * Wait until every write queued before this call has been applied.
     *
     * @param timeout how long to wait
     * @return true if the queue drained in time
     */
    public boolean flush(Duration timeout) {
        try {
            Future<?> marker = executor.submit(() -> {});
            marker.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> pending = executor.shutdownNow();
                LOG.warnf("Metering shut down with %d usage writes still queued", pending.size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
