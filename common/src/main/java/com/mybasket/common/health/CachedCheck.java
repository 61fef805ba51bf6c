package com.mybasket.common.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Memoizes the result of one kind of check for a fixed TTL.
 *
 * <p>A fresh entry is returned as the identical object without calling the
 * loader. On a miss the loader runs synchronously while holding a lock, and
 * callers arriving during that recomputation wait and then reuse its result
 * (single-flight), so a slow dependency probe is hit once per TTL window.
 *
 * <p>The entry is stamped with the time the recomputation started.
 */
public class CachedCheck<T> {

    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Entry<T> entry;

    public CachedCheck(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public T get(Supplier<T> loader) {
        Entry<T> current = entry;
        if (isFresh(current)) {
            return current.value;
        }

        lock.lock();
        try {
            current = entry;
            if (isFresh(current)) {
                return current.value;
            }
            Instant startedAt = clock.instant();
            T value = loader.get();
            entry = new Entry<>(value, startedAt);
            return value;
        } finally {
            lock.unlock();
        }
    }

    public void invalidate() {
        entry = null;
    }

    public Duration getTtl() {
        return ttl;
    }

    private boolean isFresh(Entry<T> candidate) {
        return candidate != null && clock.instant().isBefore(candidate.computedAt.plus(ttl));
    }

    private static final class Entry<T> {
        private final T value;
        private final Instant computedAt;

        private Entry(T value, Instant computedAt) {
            this.value = value;
            this.computedAt = computedAt;
        }
    }
}
