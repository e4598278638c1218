package com.tracker.sync.reconcile;

/**
 * Reasons an orphaned target item was left in place.
 */
public enum NoticeType {
    ORPHANED_NOT_REMOVED,
    DRAFT_NOT_REMOVED
}
