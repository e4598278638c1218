package com.tracker.sync.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical field vocabulary shared by every source after normalization.
 */
public enum CanonicalField {
    ESTIMATE("Estimate", null),
    PRIORITY("Priority", null),
    PIPELINE("Pipeline", null),
    EPIC("Epic", RelationKind.EPIC_OF),
    BLOCKING("Blocked By", RelationKind.BLOCKS),
    LINKED_PR("Linked Issues", RelationKind.LINKED_PR),
    SPRINT("Sprint", null),
    POSITION("Position", null),
    WORKSPACE("Workspace", null);

    private final String label;
    private final RelationKind relationKind;

    CanonicalField(String label, RelationKind relationKind) {
        this.label = label;
        this.relationKind = relationKind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * The relation kind carried by this field, or null for scalar fields.
     */
    public RelationKind getRelationKind() {
        return relationKind;
    }

    public boolean isRelation() {
        return relationKind != null;
    }

    public static Optional<CanonicalField> forRelation(RelationKind kind) {
        return Arrays.stream(values()).filter(f -> f.relationKind == kind).findFirst();
    }

    /**
     * Looks up a field by label or enum name, ignoring case and separators.
     */
    public static Optional<CanonicalField> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = squash(label);
        return Arrays.stream(values())
                .filter(f -> squash(f.label).equals(wanted) || squash(f.name()).equals(wanted))
                .findFirst();
    }

    private static String squash(String s) {
        return s.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
    }
}
