package com.tracker.sync.core.model;

/**
 * Kinds of directed relations between issues.
 */
public enum RelationKind {
    /** from = epic, to = child issue. Rendered on the epic. */
    EPIC_OF("Epic"),
    /** from = blocking issue, to = blocked issue. Rendered on the blocked issue. */
    BLOCKS("Blocked by"),
    /** from = pull request, to = issue it fixes. Rendered on the pull request. */
    LINKED_PR("Linked pull requests");

    private final String heading;

    RelationKind(String heading) {
        this.heading = heading;
    }

    public String getHeading() {
        return heading;
    }
}
