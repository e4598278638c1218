package com.tracker.sync.metrics;

import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.matching.MatchStatus;

import java.time.Duration;

/**
 * Discards all metrics.
 */
public class NoOpSyncMetrics implements SyncMetrics {

    public static final NoOpSyncMetrics INSTANCE = new NoOpSyncMetrics();

    @Override
    public void recordPassDuration(Duration duration) {
    }

    @Override
    public void recordSourceFetched(String sourceId, int itemCount) {
    }

    @Override
    public void incrementActionApplied(ActionType type) {
    }

    @Override
    public void incrementActionFailed(ActionType type) {
    }

    @Override
    public void incrementRetry() {
    }

    @Override
    public void recordTranslation(MatchStatus status) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
