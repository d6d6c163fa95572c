package com.divigateway.common;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Single-slot cache for one derived value with a fixed time-to-live.
 * <p>
 * An entry written at {@code t} is served while {@code now - t < ttl}. Concurrent callers during a
 * recompute share the same in-flight computation, so the computation runs at most once per expiry.
 * Values rejected by {@code cacheable} (and failed computations) reach the callers that waited for
 * them but are never retained. Cancelling a caller does not cancel the computation.
 */
public final class DerivedViewCache<T> {

    private static final String SLOT = "view";

    private final AsyncCache<String, T> slot;
    private final Predicate<? super T> cacheable;

    public DerivedViewCache(Duration ttl, Clock clock, Predicate<? super T> cacheable) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        this.slot = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .buildAsync();
        this.cacheable = cacheable != null ? cacheable : value -> true;
    }

    /**
     * Cached value if still live, otherwise the result of {@code compute}, stored for later callers.
     */
    public Mono<T> getOrCompute(Supplier<Mono<T>> compute) {
        AtomicReference<CompletableFuture<T>> created = new AtomicReference<>();
        CompletableFuture<T> future = slot.get(SLOT, (key, executor) -> {
            CompletableFuture<T> computation = compute.get().toFuture();
            created.set(computation);
            return computation;
        });
        CompletableFuture<T> computation = created.get();
        if (computation != null) {
            // runs once per computation, whether or not any caller is still subscribed
            computation.thenAccept(value -> evictIfRejected(computation, value));
        }
        return Mono.fromFuture(future, true);
    }

    private void evictIfRejected(CompletableFuture<T> computation, T value) {
        if (!cacheable.test(value)) {
            slot.asMap().remove(SLOT, computation);
        }
    }
}
