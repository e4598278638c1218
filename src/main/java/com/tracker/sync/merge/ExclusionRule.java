package com.tracker.sync.merge;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.Relation;
import com.tracker.sync.core.model.SourceRecord;

import java.util.Objects;

/**
 * Drops a source record entirely when one of its field values matches a glob.
 * {@code Workspace:Private*} excludes whole workspaces, {@code Pipeline:Done} whole pipelines.
 */
public record ExclusionRule(CanonicalField field, GlobPattern pattern) {

    public ExclusionRule {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(pattern, "pattern is required");
    }

    /**
     * Parses {@code FIELD:PATTERN}. The pattern may itself contain colons.
     *
     * @throws IllegalArgumentException on a missing separator or an unknown field
     */
    public static ExclusionRule parse(String spec) {
        if (spec == null || !spec.contains(":")) {
            throw new IllegalArgumentException("Exclusion must look like FIELD:PATTERN, got '" + spec + "'");
        }
        int colon = spec.indexOf(':');
        String fieldName = spec.substring(0, colon).trim();
        CanonicalField field = CanonicalField.fromLabel(fieldName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown exclusion field '" + fieldName + "'"));
        return new ExclusionRule(field, GlobPattern.compile(spec.substring(colon + 1)));
    }

    public boolean excludes(SourceRecord record) {
        if (field.isRelation()) {
            for (Relation r : record.relationsOf(field.getRelationKind())) {
                if (pattern.matches(r.referenced().toString())) {
                    return true;
                }
            }
            return false;
        }
        return pattern.matches(record.get(field).text());
    }

    /**
     * True if this rule would exclude a plain value of its field, e.g. a workspace name.
     */
    public boolean excludesValue(CanonicalField f, String value) {
        return field == f && pattern.matches(value);
    }

    @Override
    public String toString() {
        return field.getLabel() + ":" + pattern;
    }
}
