package com.tracker.sync.metrics;

import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.matching.MatchStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerSyncMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerSyncMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerSyncMetrics(registry);
    }

    @Test
    @DisplayName("Should count actions by type")
    void testActions() {
        metrics.incrementActionApplied(ActionType.CREATE);
        metrics.incrementActionApplied(ActionType.CREATE);
        metrics.incrementActionFailed(ActionType.REMOVE);

        assertEquals(2.0, registry.get("sync.action.applied").tag("type", "CREATE").counter().count());
        assertEquals(1.0, registry.get("sync.action.failed").tag("type", "REMOVE").counter().count());
    }

    @Test
    @DisplayName("Should record pass duration and items per source")
    void testPassAndSources() {
        metrics.recordPassDuration(Duration.ofMillis(1500));
        metrics.recordSourceFetched("Team A", 12);
        metrics.recordSourceFetched("Team A", 8);

        assertEquals(1500.0, registry.get("sync.pass.duration").timer().totalTime(TimeUnit.MILLISECONDS));
        assertEquals(20.0, registry.get("sync.source.items").tag("source", "Team A").summary().totalAmount());
    }

    @Test
    @DisplayName("Should count translations, retries and cache lookups")
    void testCounters() {
        metrics.recordTranslation(MatchStatus.MATCHED);
        metrics.recordTranslation(MatchStatus.NO_MATCH);
        metrics.incrementRetry();
        metrics.recordCacheHit();
        metrics.recordCacheMiss();
        metrics.recordCacheMiss();

        assertEquals(1.0, registry.get("sync.translation").tag("status", "NO_MATCH").counter().count());
        assertEquals(1.0, registry.get("sync.retry").counter().count());
        assertEquals(1.0, registry.get("sync.cache.hit").counter().count());
        assertEquals(2.0, registry.get("sync.cache.miss").counter().count());
    }
}
