package com.tracker.sync.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The priority-resolved combination of every source record sharing an issue key.
 *
 * @param key        issue identity
 * @param fields     resolved scalar fields
 * @param provenance source id that supplied each resolved field (relation fields included)
 * @param relations  resolved relations, in stable order
 * @param pullRequest true when the issue is a pull request
 */
public record MergedIssue(
        IssueKey key,
        Map<CanonicalField, FieldValue> fields,
        Map<CanonicalField, String> provenance,
        SortedSet<Relation> relations,
        boolean pullRequest
) {
    public MergedIssue {
        Objects.requireNonNull(key, "key is required");
        fields = fields != null && !fields.isEmpty() ? Map.copyOf(new EnumMap<>(fields)) : Map.of();
        provenance = provenance != null ? Map.copyOf(provenance) : Map.of();
        relations = Collections.unmodifiableSortedSet(relations != null ? new TreeSet<>(relations) : new TreeSet<>());
    }

    public FieldValue get(CanonicalField field) {
        return fields.getOrDefault(field, FieldValue.empty());
    }

    public Set<Relation> relationsOf(RelationKind kind) {
        Set<Relation> result = new TreeSet<>();
        for (Relation r : relations) {
            if (r.kind() == kind) {
                result.add(r);
            }
        }
        return result;
    }

    /**
     * True when this is a pull request that fixes at least one issue.
     */
    public boolean isLinkedPullRequest() {
        return pullRequest && !relationsOf(RelationKind.LINKED_PR).isEmpty();
    }
}
