package com.openforge.gateway.cache;

import com.openforge.gateway.llm.model.CompletionResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Exact-match, TTL-bounded memo of completion responses.
 *
 * An entry is visible while {@code now < expiresAt}.  Expired entries are
 * not swept; they stay in the map, are reported as misses, and are
 * overwritten by the next {@link #put} for the same key.
 */
public class ResponseCache {

    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> entries = new HashMap<>();

    private final AtomicLong hits   = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResponseCache(Clock clock) {
        this.clock = clock;
    }

    public Optional<CompletionResponse> get(String key) {
        Entry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null || !clock.instant().isBefore(entry.expiresAt())) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.response());
    }

    public void put(String key, CompletionResponse response, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        lock.writeLock().lock();
        try {
            entries.put(key, new Entry(response, expiresAt));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of stored entries, expired ones included. */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public double hitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    private record Entry(CompletionResponse response, Instant expiresAt) {}
}
