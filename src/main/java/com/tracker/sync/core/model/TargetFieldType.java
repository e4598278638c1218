package com.tracker.sync.core.model;

/**
 * Data types of target project fields.
 */
public enum TargetFieldType {
    TEXT,
    NUMBER,
    SINGLE_SELECT,
    ITERATION,
    DATE;

    /**
     * Fields that take one of a fixed list of options.
     */
    public boolean hasOptions() {
        return this == SINGLE_SELECT || this == ITERATION;
    }
}
