package com.williamcallahan.articleserver.service.cache;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Runs at most one computation per key at a time.
 *
 * <p>The first caller for a key registers a pending future and runs the work on its own thread;
 * callers arriving while it is in flight wait on that future instead of repeating the work. The
 * registry is only touched to register and deregister, never while the work runs, so slow work
 * for one key does not hold up other keys. A failure is delivered to every waiter and the key is
 * released so a later call retries.</p>
 *
 * @param <K> key type
 * @param <V> result type
 */
public class RenderCoalescer<K, V> {

    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    /**
     * Returns the result of {@code work} for {@code key}, sharing an in-flight computation if one exists.
     *
     * @param key computation key
     * @param work computation to run when no computation for {@code key} is in flight
     * @return the computed or shared result
     * @throws RuntimeException whatever the computation threw
     */
    public V computeOnce(K key, Supplier<V> work) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(work, "work");

        CompletableFuture<V> pending = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            return await(existing);
        }

        try {
            V result = work.get();
            pending.complete(result);
            return result;
        } catch (RuntimeException | Error failure) {
            pending.completeExceptionally(failure);
            throw failure;
        } finally {
            inFlight.remove(key, pending);
        }
    }

    /**
     * Returns the number of keys with a computation currently running.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private V await(CompletableFuture<V> existing) {
        try {
            return existing.join();
        } catch (CompletionException wrapped) {
            Throwable cause = wrapped.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw wrapped;
        }
    }
}
