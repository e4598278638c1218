package com.tracker.sync.core.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Directed edge between two issues. Both endpoints are always resolved keys.
 */
public record Relation(RelationKind kind, IssueKey from, IssueKey to) implements Comparable<Relation> {

    private static final Comparator<Relation> ORDER = Comparator
            .comparing(Relation::kind)
            .thenComparing(Relation::from)
            .thenComparing(Relation::to);

    public Relation {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
    }

    public static Relation epicOf(IssueKey epic, IssueKey child) {
        return new Relation(RelationKind.EPIC_OF, epic, child);
    }

    public static Relation blocks(IssueKey blocker, IssueKey blocked) {
        return new Relation(RelationKind.BLOCKS, blocker, blocked);
    }

    public static Relation fixes(IssueKey pullRequest, IssueKey issue) {
        return new Relation(RelationKind.LINKED_PR, pullRequest, issue);
    }

    /**
     * The issue whose body (or pull request) displays this relation.
     */
    public IssueKey subject() {
        return kind == RelationKind.BLOCKS ? to : from;
    }

    /**
     * The issue listed in the subject's block.
     */
    public IssueKey referenced() {
        return kind == RelationKind.BLOCKS ? from : to;
    }

    @Override
    public int compareTo(Relation other) {
        return ORDER.compare(this, other);
    }
}
