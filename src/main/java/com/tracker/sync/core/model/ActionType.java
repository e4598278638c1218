package com.tracker.sync.core.model;

/**
 * Kinds of reconciler actions.
 */
public enum ActionType {
    CREATE,
    UPDATE,
    /** Body change to an issue that is kept off the board. */
    EDIT_BODY,
    REMOVE
}
