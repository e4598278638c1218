package com.tracker.sync.audit;

/**
 * Types of auditable actions in a reconciliation pass.
 */
public enum AuditAction {
    ITEM_CREATED,
    ITEM_UPDATED,
    ITEM_REMOVED,
    ITEM_ORPHANED,
    PR_LINKED,
    ACTION_FAILED,
    IDENTITY_CONFLICT,
    CONFIGURATION_ERROR
}
