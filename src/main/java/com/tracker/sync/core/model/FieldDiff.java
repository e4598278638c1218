package com.tracker.sync.core.model;

import java.util.Objects;

/**
 * A single field change. {@code to == null} clears the field.
 */
public record FieldDiff(String field, String from, String to) {

    public FieldDiff {
        Objects.requireNonNull(field, "field is required");
    }

    @Override
    public String toString() {
        return field + ": '" + (from == null ? "" : from) + "' -> '" + (to == null ? "" : to) + "'";
    }
}
