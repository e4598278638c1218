package com.tracker.sync.reconcile;

import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.core.model.IssueKey;

/**
 * A target write that did not go through, after retries.
 *
 * @param operation the step that failed, such as {@code updateFields} or {@code moveItem}
 */
public record FailedAction(ActionType type, IssueKey key, String operation, String message) {

    @Override
    public String toString() {
        return type + " " + key + " " + operation + ": " + message;
    }
}
