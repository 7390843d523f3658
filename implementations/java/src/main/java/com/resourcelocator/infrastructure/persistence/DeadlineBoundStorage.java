package com.resourcelocator.infrastructure.persistence;

import com.resourcelocator.domain.model.AuditEvent;
import com.resourcelocator.domain.model.ResourceDefinition;
import com.resourcelocator.domain.repository.StorageAdapter;
import com.resourcelocator.domain.repository.StorageUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs Storage Adapter calls on the storage executor and waits no longer than the
 * caller's deadline, or the configured timeout when the caller gave none.
 *
 * <p>Every failure mode (adapter exception, timeout, interruption, saturated executor)
 * surfaces as {@link StorageUnavailableException}. A timed-out call is cancelled; the
 * adapter may still finish it in the background.
 *
 * @since 1.0.0
 */
@Slf4j
public class DeadlineBoundStorage {

    private final StorageAdapter adapter;
    private final Executor executor;
    private final Duration defaultTimeout;
    private final Clock clock;

    public DeadlineBoundStorage(StorageAdapter adapter, Executor executor, Duration defaultTimeout, Clock clock) {
        this.adapter = adapter;
        this.executor = executor;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
    }

    public Optional<ResourceDefinition> getConnection(String logicalName, Instant deadline) {
        return call("getConnection", () -> adapter.getConnection(logicalName), deadline);
    }

    public void registerConnection(ResourceDefinition definition) {
        registerConnection(definition, null);
    }

    /**
     * Register a definition, running {@code onSettled} once the adapter call has returned or
     * failed. The callback also runs when the write outlives the timeout and lands after this
     * method has already thrown.
     *
     * @param definition Definition to persist
     * @param onSettled Callback run on the storage thread after the write, may be {@code null}
     */
    public void registerConnection(ResourceDefinition definition, Runnable onSettled) {
        call("registerConnection", () -> {
            try {
                adapter.registerConnection(definition);
            } finally {
                if (onSettled != null) {
                    onSettled.run();
                }
            }
            return null;
        }, null);
    }

    public void logEvent(AuditEvent event, Instant deadline) {
        call("logEvent", () -> {
            adapter.logEvent(event);
            return null;
        }, deadline);
    }

    public StorageAdapter adapter() {
        return adapter;
    }

    private <T> T call(String operation, Supplier<T> action, Instant deadline) {
        Duration budget = deadline != null ? Duration.between(clock.instant(), deadline) : defaultTimeout;
        if (budget.isNegative() || budget.isZero()) {
            throw new StorageUnavailableException("Deadline exceeded before " + operation + " started");
        }

        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(action, executor);
        } catch (RejectedExecutionException e) {
            throw new StorageUnavailableException("Storage executor rejected " + operation, e);
        }

        try {
            return future.get(budget.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Storage {} timed out after {}", operation, budget);
            throw new StorageUnavailableException("Storage " + operation + " timed out after " + budget, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while waiting for storage " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageUnavailableException) {
                throw (StorageUnavailableException) cause;
            }
            throw new StorageUnavailableException("Storage " + operation + " failed", cause);
        }
    }
}
