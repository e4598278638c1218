package com.tracker.sync.core.model;

/**
 * Move an item directly after {@code after} in its column, or to the top when {@code after} is null.
 */
public record PositionChange(IssueKey after) {

    public static PositionChange top() {
        return new PositionChange(null);
    }

    public boolean toTop() {
        return after == null;
    }

    @Override
    public String toString() {
        return after == null ? "top" : "after " + after;
    }
}
