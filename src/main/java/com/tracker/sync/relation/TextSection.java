package com.tracker.sync.relation;

import java.util.List;
import java.util.Objects;

/**
 * A plain sub-section of the checklist block, used for scalar fields mapped to the body.
 */
public record TextSection(String title, List<String> lines) {

    public TextSection {
        Objects.requireNonNull(title, "title is required");
        lines = lines != null ? List.copyOf(lines) : List.of();
    }

    public static TextSection of(String title, String value) {
        return new TextSection(title, List.of("- " + value));
    }
}
