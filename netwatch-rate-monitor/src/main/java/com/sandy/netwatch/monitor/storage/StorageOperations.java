package com.sandy.netwatch.monitor.storage;

import com.sandy.netwatch.monitor.config.MonitorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs backing store calls on the storage executor with a per-attempt timeout and bounded exponential backoff,
 * so a slow or dead store never stalls a key's tick for longer than
 * {@code maxAttempts * timeout + sum(backoff)}.
 */
@Component
@Slf4j
public class StorageOperations {

    private final BlockStore blockStore;
    private final AsyncTaskExecutor executor;
    private final long timeoutMs;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double backoffMultiplier;

    @Autowired
    public StorageOperations(BlockStore blockStore,
                             @Qualifier("storageExecutor") AsyncTaskExecutor executor,
                             MonitorProperties properties) {
        this(blockStore, executor,
                properties.getStorage().getOperationTimeoutMs(),
                properties.getStorage().getMaxAttempts(),
                properties.getStorage().getInitialBackoffMs(),
                properties.getStorage().getBackoffMultiplier());
    }

    public StorageOperations(BlockStore blockStore, AsyncTaskExecutor executor,
                             long timeoutMs, int maxAttempts, long initialBackoffMs, double backoffMultiplier) {
        this.blockStore = blockStore;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
        this.backoffMultiplier = backoffMultiplier;
    }

    public <T> T call(String operation, Function<BlockStore, T> op) {
        long backoff = initialBackoffMs;
        Throwable last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<T> future = null;
            try {
                future = executor.submit(() -> op.apply(blockStore));
                return future.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel(future);
                throw new StorageException("Interrupted during " + operation, e);
            } catch (TimeoutException e) {
                cancel(future);
                last = e;
                log.warn("Storage operation timed out: op={} attempt={}/{} timeoutMs={}", operation, attempt, maxAttempts, timeoutMs);
            } catch (ExecutionException e) {
                last = e.getCause() != null ? e.getCause() : e;
                log.warn("Storage operation failed: op={} attempt={}/{} error={}", operation, attempt, maxAttempts, last.getMessage());
            } catch (RuntimeException e) {
                // executor saturated or shut down
                last = e;
                log.warn("Storage operation not accepted: op={} attempt={}/{} error={}", operation, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && backoff > 0) {
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StorageException("Interrupted while backing off " + operation, ie);
                }
                backoff = (long) (backoff * backoffMultiplier);
            }
        }
        throw new StorageException("Storage operation " + operation + " failed after " + maxAttempts + " attempts", last);
    }

    public void run(String operation, Consumer<BlockStore> op) {
        call(operation, store -> {
            op.accept(store);
            return Boolean.TRUE;
        });
    }

    private static void cancel(Future<?> future) {
        if (future != null) future.cancel(true);
    }
}
