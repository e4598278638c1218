package com.tracker.sync.mapping;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.matching.MatchStrategy;

import java.util.Locale;
import java.util.Objects;

/**
 * Transfer of one canonical source field into one destination.
 *
 * @param sourceField canonical field read from the merged issue
 * @param destination target field name or one of the special destinations; null disables the field
 * @param strategy    option translation strategy, null for the default
 */
public record FieldMappingRule(CanonicalField sourceField, String destination, MatchStrategy strategy) {

    /** Renders into the checklist block of the issue body. */
    public static final String TEXT = "Text";
    /** Orders the item within its status column. */
    public static final String POSITION = "Position";
    /** Adds {@code fixes} directives to the body of each linked pull request. */
    public static final String LINKED_PULL_REQUESTS = "Linked pull requests";

    public FieldMappingRule {
        Objects.requireNonNull(sourceField, "sourceField is required");
        if (destination != null && destination.isBlank()) {
            destination = null;
        }
    }

    public static FieldMappingRule of(CanonicalField sourceField, String destination) {
        return new FieldMappingRule(sourceField, destination, null);
    }

    public static FieldMappingRule of(CanonicalField sourceField, String destination, MatchStrategy strategy) {
        return new FieldMappingRule(sourceField, destination, strategy);
    }

    /**
     * Parses {@code SRC:DST[:CNV]}. {@code SRC} alone maps to a destination of the same name;
     * {@code SRC:} disables the field.
     *
     * @throws IllegalArgumentException on an unknown source field or strategy
     */
    public static FieldMappingRule parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Field mapping must not be empty");
        }
        String[] parts = spec.split(":", -1);
        String sourceName = parts[0].trim();
        CanonicalField field = CanonicalField.fromLabel(sourceName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown source field '" + sourceName + "'"));
        if (parts.length == 1) {
            return new FieldMappingRule(field, sourceName, null);
        }
        String destination = parts[1].trim();
        MatchStrategy strategy = null;
        if (parts.length > 2 && !parts[2].isBlank()) {
            strategy = MatchStrategy.parse(parts[2])
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown conversion '" + parts[2] + "' in '" + spec + "', use Exact, Closest or Scale"));
        }
        return new FieldMappingRule(field, destination, strategy);
    }

    public boolean isDisabled() {
        return destination == null;
    }

    public boolean isText() {
        return TEXT.equalsIgnoreCase(destination);
    }

    public boolean isPosition() {
        return POSITION.equalsIgnoreCase(destination);
    }

    public boolean isLinkedPullRequests() {
        return LINKED_PULL_REQUESTS.equalsIgnoreCase(destination);
    }

    public MatchStrategy effectiveStrategy() {
        return strategy != null ? strategy : MatchStrategy.DEFAULT;
    }

    @Override
    public String toString() {
        return sourceField.getLabel() + ":" + (destination == null ? "" : destination)
                + (strategy == null ? "" : ":" + strategy.name().charAt(0)
                + strategy.name().substring(1).toLowerCase(Locale.ROOT));
    }
}
