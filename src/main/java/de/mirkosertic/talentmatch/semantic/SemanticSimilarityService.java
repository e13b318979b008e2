package de.mirkosertic.talentmatch.semantic;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import de.mirkosertic.talentmatch.config.ApplicationConfig;
import de.mirkosertic.talentmatch.model.DeadlineExceededException;
import de.mirkosertic.talentmatch.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for all similarity queries of a matching run.
 *
 * <p>Provider calls run on the {@link SimilarityExecutorService} with a per-call
 * timeout that starts when a worker picks the call up. A queued call may wait for
 * one timeout per wave of calls ahead of it; a call the pool rejects is degraded
 * right away and never runs on the calling thread. Successful provider answers are cached; identical requests within a
 * batch share one call. A provider that is absent, reports itself unavailable,
 * fails or times out never fails the batch: the affected requests are answered
 * by the {@link LexicalSimilarityProvider} if the heuristic fallback is enabled,
 * otherwise with an {@link SimilarityOutcome#unavailable() unavailable} outcome.</p>
 *
 * <p>The only error that escapes is {@link DeadlineExceededException}, raised
 * when the run deadline passes before all answers are in.</p>
 */
public class SemanticSimilarityService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SemanticSimilarityService.class);

    private record CacheKey(SimilarityKind kind, String first, String second) {

        static CacheKey of(final SimilarityRequest request) {
            final String left;
            final String right;
            if (request.kind() == SimilarityKind.TEXT) {
                left = TextCleaner.normalizeKey(request.leftText());
                right = TextCleaner.normalizeKey(request.rightText());
            } else {
                left = sortedTags(request.left());
                right = sortedTags(request.right());
            }
            // Similarity is symmetric, so (a, b) and (b, a) share an entry
            if (left.compareTo(right) <= 0) {
                return new CacheKey(request.kind(), left, right);
            }
            return new CacheKey(request.kind(), right, left);
        }

        private static String sortedTags(final List<String> tags) {
            final List<String> normalized = new ArrayList<>(TextCleaner.normalizeTags(tags));
            Collections.sort(normalized);
            return String.join("|", normalized);
        }
    }

    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    /**
     * @param startedNanos   when a worker began the call, {@link #NOT_STARTED} while queued
     * @param queueLimitNanos latest time the call may still be waiting for a worker
     */
    private record PendingCall(SimilarityRequest request, Future<Double> future, AtomicLong startedNanos,
                               long queueLimitNanos) {

        boolean started() {
            return startedNanos.get() != NOT_STARTED;
        }
    }

    private final @Nullable SemanticSimilarityProvider provider;
    private final LexicalSimilarityProvider heuristic;
    private final SimilarityExecutorService executor;
    private final long timeoutMs;
    private final boolean heuristicFallback;
    private final Cache<CacheKey, Double> cache;
    private final SimilarityCacheStats stats = new SimilarityCacheStats();

    public SemanticSimilarityService(final @Nullable SemanticSimilarityProvider provider,
                                     final LexicalSimilarityProvider heuristic,
                                     final SimilarityExecutorService executor,
                                     final ApplicationConfig config) {
        this(provider, heuristic, executor, config.getSimilarityTimeoutMs(),
                config.getSimilarityCacheSize(), config.isHeuristicFallback());
    }

    public SemanticSimilarityService(final @Nullable SemanticSimilarityProvider provider,
                                     final LexicalSimilarityProvider heuristic,
                                     final SimilarityExecutorService executor,
                                     final long timeoutMs,
                                     final long cacheSize,
                                     final boolean heuristicFallback) {
        this.provider = provider;
        this.heuristic = heuristic;
        this.executor = executor;
        this.timeoutMs = timeoutMs;
        this.heuristicFallback = heuristicFallback;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(0, cacheSize))
                .evictionListener((CacheKey key, Double value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();

        logger.info("SemanticSimilarityService initialized: provider={}, timeout={}ms, cacheSize={}, heuristicFallback={}",
                getProviderName(), timeoutMs, cacheSize, heuristicFallback);
    }

    /**
     * Answers a single request without a run deadline.
     */
    public SimilarityOutcome similarity(final SimilarityRequest request) {
        return fetchSimilarities(List.of(request), null).get(0);
    }

    /**
     * Answers all requests, in request order.
     *
     * @param requests the comparisons to make
     * @param deadline end of the run, or null for no deadline
     * @return one outcome per request, at the same index
     * @throws DeadlineExceededException if the deadline passes before all answers are in
     */
    public List<SimilarityOutcome> fetchSimilarities(final List<SimilarityRequest> requests, final @Nullable Instant deadline) {
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            throw new DeadlineExceededException("Deadline passed before similarities were requested");
        }
        final SimilarityOutcome[] outcomes = new SimilarityOutcome[requests.size()];
        if (!isProviderAvailable()) {
            for (int i = 0; i < requests.size(); i++) {
                outcomes[i] = degrade(requests.get(i));
            }
            return Arrays.asList(outcomes);
        }

        final Map<CacheKey, PendingCall> pending = new LinkedHashMap<>();
        final CacheKey[] keys = new CacheKey[requests.size()];
        for (int i = 0; i < requests.size(); i++) {
            final SimilarityRequest request = requests.get(i);
            final CacheKey key = CacheKey.of(request);
            final Double cached = cache.getIfPresent(key);
            if (cached != null) {
                stats.recordHit();
                outcomes[i] = SimilarityOutcome.provider(cached);
                continue;
            }
            stats.recordMiss();
            keys[i] = key;
            if (!pending.containsKey(key)) {
                pending.put(key, submit(request, pending.size()));
            }
        }

        final Map<CacheKey, SimilarityOutcome> answers = new LinkedHashMap<>();
        int degraded = 0;
        try {
            for (final Map.Entry<CacheKey, PendingCall> entry : pending.entrySet()) {
                final Double score = await(entry.getValue(), deadline);
                if (score != null) {
                    cache.put(entry.getKey(), score);
                    answers.put(entry.getKey(), SimilarityOutcome.provider(score));
                } else {
                    answers.put(entry.getKey(), degrade(entry.getValue().request()));
                    degraded++;
                }
            }
        } finally {
            for (final PendingCall call : pending.values()) {
                if (!call.future().isDone()) {
                    call.future().cancel(true);
                }
            }
            stats.setCurrentSize(cache.estimatedSize());
        }

        if (degraded > 0) {
            logger.warn("{} of {} similarity calls to {} failed or timed out, using {}",
                    degraded, pending.size(), getProviderName(), heuristicFallback ? "lexical heuristic" : "no semantic score");
        }

        for (int i = 0; i < requests.size(); i++) {
            if (outcomes[i] == null) {
                outcomes[i] = answers.get(keys[i]);
            }
        }
        return Arrays.asList(outcomes);
    }

    private PendingCall submit(final SimilarityRequest request, final int position) {
        final SemanticSimilarityProvider target = provider;
        final AtomicLong startedNanos = new AtomicLong(NOT_STARTED);
        final long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        // Calls ahead of this one run in waves of pool size, each wave bounded by the timeout
        final long waves = position / executor.getPoolSize();
        final long queueLimitNanos = System.nanoTime() + timeoutNanos * waves + timeoutNanos;
        Future<Double> future;
        try {
            future = executor.submit(() -> {
                startedNanos.set(System.nanoTime());
                if (request.kind() == SimilarityKind.TEXT) {
                    return target.textSimilarity(request.leftText(), request.rightText());
                }
                return target.tagSimilarity(request.left(), request.right());
            });
        } catch (final RejectedExecutionException e) {
            logger.debug("Similarity pool rejected a call to {}: {}", getProviderName(), e.getMessage());
            future = CompletableFuture.failedFuture(e);
        }
        return new PendingCall(request, future, startedNanos, queueLimitNanos);
    }

    private @Nullable Double await(final PendingCall call, final @Nullable Instant deadline) {
        final long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            while (true) {
                final long now = System.nanoTime();
                final boolean started = call.started();
                long waitNanos = started
                        ? call.startedNanos().get() + timeoutNanos - now
                        : call.queueLimitNanos() - now;
                boolean boundByDeadline = false;
                if (deadline != null) {
                    final long remaining = Duration.between(Instant.now(), deadline).toNanos();
                    if (remaining <= waitNanos) {
                        waitNanos = remaining;
                        boundByDeadline = true;
                    }
                }
                if (waitNanos <= 0 && !call.future().isDone()) {
                    return timedOut(call, boundByDeadline, started);
                }
                // While queued, wake up regularly to switch to the per-call timeout once a worker has it
                final long sliceNanos = started ? waitNanos : Math.min(waitNanos, POLL_NANOS);
                try {
                    return call.future().get(Math.max(0L, sliceNanos), TimeUnit.NANOSECONDS);
                } catch (final TimeoutException e) {
                    if (started || sliceNanos == waitNanos) {
                        return timedOut(call, boundByDeadline, started);
                    }
                }
            }
        } catch (final ExecutionException e) {
            stats.recordProviderFailure();
            logger.debug("Similarity call to {} failed: {}", getProviderName(), e.getCause().getMessage());
            return null;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Interrupted while waiting for similarity provider " + getProviderName());
        }
    }

    private @Nullable Double timedOut(final PendingCall call, final boolean boundByDeadline, final boolean started) {
        call.future().cancel(true);
        if (boundByDeadline) {
            throw new DeadlineExceededException("Deadline passed while waiting for similarity provider " + getProviderName());
        }
        stats.recordProviderTimeout();
        if (started) {
            logger.debug("Similarity call to {} timed out after {}ms", getProviderName(), timeoutMs);
        } else {
            logger.debug("Similarity call to {} never reached a worker in time", getProviderName());
        }
        return null;
    }

    private SimilarityOutcome degrade(final SimilarityRequest request) {
        if (!heuristicFallback) {
            return SimilarityOutcome.unavailable();
        }
        if (request.kind() == SimilarityKind.TEXT) {
            return SimilarityOutcome.heuristic(heuristic.textSimilarity(request.leftText(), request.rightText()));
        }
        return SimilarityOutcome.heuristic(heuristic.tagSimilarity(request.left(), request.right()));
    }

    public boolean isProviderAvailable() {
        if (provider == null) {
            return false;
        }
        try {
            return provider.isAvailable();
        } catch (final RuntimeException e) {
            logger.warn("Availability check of similarity provider {} failed", provider.getName(), e);
            return false;
        }
    }

    public String getProviderName() {
        return provider == null ? "none" : provider.getName();
    }

    public boolean isHeuristicFallback() {
        return heuristicFallback;
    }

    public SimilarityCacheStats getStats() {
        return stats;
    }

    /**
     * Health snapshot: provider name and availability plus cache statistics.
     */
    public SimilarityStatus status() {
        stats.setCurrentSize(cache.estimatedSize());
        return new SimilarityStatus(
                getProviderName(),
                isProviderAvailable(),
                heuristicFallback,
                stats.getCacheHits(),
                stats.getCacheMisses(),
                stats.getCurrentSize(),
                stats.getHitRate(),
                stats.getProviderFailures(),
                stats.getProviderTimeouts());
    }

    @Override
    public void close() {
        logger.info("Closing SemanticSimilarityService: {}", stats.getMetrics());
        cache.invalidateAll();
        heuristic.close();
    }
}
