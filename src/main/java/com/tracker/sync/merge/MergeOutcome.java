package com.tracker.sync.merge;

import com.tracker.sync.core.model.MergedIssue;

import java.util.List;

/**
 * Result of merging all sources.
 *
 * @param issues          one merged issue per surviving key, sorted by key
 * @param conflicts       keys skipped because of identity conflicts
 * @param excludedRecords number of source records dropped by exclusion rules
 */
public record MergeOutcome(List<MergedIssue> issues, List<IdentityConflict> conflicts, int excludedRecords) {

    public MergeOutcome {
        issues = issues != null ? List.copyOf(issues) : List.of();
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
