package de.mirkosertic.talentmatch.semantic;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters for the similarity cache and for provider failures.
 */
public class SimilarityCacheStats {

    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong providerFailures = new AtomicLong(0);
    private final AtomicLong providerTimeouts = new AtomicLong(0);
    private final AtomicLong cacheSize = new AtomicLong(0);

    public void recordHit() {
        cacheHits.incrementAndGet();
    }

    public void recordMiss() {
        cacheMisses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void recordProviderFailure() {
        providerFailures.incrementAndGet();
    }

    public void recordProviderTimeout() {
        providerTimeouts.incrementAndGet();
    }

    public void setCurrentSize(final long size) {
        cacheSize.set(size);
    }

    public long getTotalRequests() {
        return cacheHits.get() + cacheMisses.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getProviderFailures() {
        return providerFailures.get();
    }

    public long getProviderTimeouts() {
        return providerTimeouts.get();
    }

    public long getCurrentSize() {
        return cacheSize.get();
    }

    /**
     * Cache hit rate as a percentage (0-100), or 0.0 if nothing was requested yet.
     */
    public double getHitRate() {
        final long total = getTotalRequests();
        if (total == 0) {
            return 0.0;
        }
        return (cacheHits.get() * 100.0) / total;
    }

    public String getMetrics() {
        return String.format(Locale.ROOT,
                "SimilarityCacheStats[total=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d, evictions=%d, failures=%d, timeouts=%d]",
                getTotalRequests(),
                getCacheHits(),
                getCacheMisses(),
                getHitRate(),
                getCurrentSize(),
                getEvictions(),
                getProviderFailures(),
                getProviderTimeouts()
        );
    }

    @Override
    public String toString() {
        return getMetrics();
    }
}
