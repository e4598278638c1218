package com.tracker.sync.metrics;

import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.matching.MatchStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based {@link SyncMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code sync.pass.duration}: Timer</li>
 *   <li>{@code sync.source.items}: DistributionSummary (tag: source)</li>
 *   <li>{@code sync.action.applied}: Counter (tag: type)</li>
 *   <li>{@code sync.action.failed}: Counter (tag: type)</li>
 *   <li>{@code sync.retry}: Counter</li>
 *   <li>{@code sync.translation}: Counter (tag: status)</li>
 *   <li>{@code sync.cache.hit} and {@code sync.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerSyncMetrics implements SyncMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Timer passTimer;
    private final Counter retryCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerSyncMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.passTimer = Timer.builder("sync.pass.duration")
                .description("Duration of reconciliation passes")
                .register(registry);
        this.retryCounter = Counter.builder("sync.retry")
                .description("Number of retried target or source calls")
                .register(registry);
        this.cacheHitCounter = Counter.builder("sync.cache.hit")
                .description("Number of issue lookup cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("sync.cache.miss")
                .description("Number of issue lookup cache misses")
                .register(registry);
    }

    @Override
    public void recordPassDuration(Duration duration) {
        passTimer.record(duration);
    }

    @Override
    public void recordSourceFetched(String sourceId, int itemCount) {
        summaryCache.computeIfAbsent(sourceId, k ->
                DistributionSummary.builder("sync.source.items")
                        .description("Items fetched per source")
                        .tag("source", sourceId)
                        .register(registry))
                .record(itemCount);
    }

    @Override
    public void incrementActionApplied(ActionType type) {
        counter("sync.action.applied", "type", type.name(), "Actions applied to the target").increment();
    }

    @Override
    public void incrementActionFailed(ActionType type) {
        counter("sync.action.failed", "type", type.name(), "Actions that failed after retries").increment();
    }

    @Override
    public void incrementRetry() {
        retryCounter.increment();
    }

    @Override
    public void recordTranslation(MatchStatus status) {
        counter("sync.translation", "status", status.name(), "Option translations by outcome").increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String tag, String value, String description) {
        return counterCache.computeIfAbsent(name + ":" + value, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
