package com.tracker.sync.reconcile;

import com.tracker.sync.core.model.IssueKey;

import java.util.Objects;

/**
 * Something the operator should know about that needs no target change.
 *
 * @param key    issue identity, null for draft items
 * @param itemId target item id
 */
public record Notice(NoticeType type, IssueKey key, String itemId, String message) {

    public Notice {
        Objects.requireNonNull(type, "type is required");
    }

    @Override
    public String toString() {
        return type + " " + (key != null ? key : itemId) + (message != null ? " - " + message : "");
    }
}
