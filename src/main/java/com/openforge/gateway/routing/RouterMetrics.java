package com.openforge.gateway.routing;

import java.util.concurrent.atomic.AtomicLong;

/** Per-router counters, read by the admin endpoint. */
public final class RouterMetrics {

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong cacheHits  = new AtomicLong();
    private final AtomicLong localHits  = new AtomicLong();
    private final AtomicLong cloudHits  = new AtomicLong();
    private final AtomicLong errors     = new AtomicLong();

    void call()     { totalCalls.incrementAndGet(); }
    void cacheHit() { cacheHits.incrementAndGet(); }
    void local()    { localHits.incrementAndGet(); }
    void cloud()    { cloudHits.incrementAndGet(); }
    void error()    { errors.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(totalCalls.get(), cacheHits.get(), localHits.get(), cloudHits.get(), errors.get());
    }

    public record Snapshot(long totalCalls, long cacheHits, long localHits, long cloudHits, long errors) {}
}
