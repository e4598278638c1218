package com.tracker.sync.metrics;

import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.matching.MatchStatus;

import java.time.Duration;

/**
 * Records reconciliation metrics. {@link NoOpSyncMetrics} is the default, so nothing
 * needs a registry unless metrics are wanted.
 */
public interface SyncMetrics {

    void recordPassDuration(Duration duration);

    void recordSourceFetched(String sourceId, int itemCount);

    void incrementActionApplied(ActionType type);

    void incrementActionFailed(ActionType type);

    void incrementRetry();

    void recordTranslation(MatchStatus status);

    void recordCacheHit();

    void recordCacheMiss();
}
