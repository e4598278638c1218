package com.tracker.sync.reconcile;

import java.util.List;

/**
 * Outcome of applying a plan.
 *
 * @param bodyChanges issue bodies actually rewritten
 * @param pullRequestsLinked pull request bodies that received new directives
 */
public record ApplyResult(
        int created,
        int updated,
        int removed,
        int bodyChanges,
        int moved,
        int pullRequestsLinked,
        List<FailedAction> failures
) {
    public ApplyResult {
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static ApplyResult empty() {
        return new ApplyResult(0, 0, 0, 0, 0, 0, List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
