package com.tracker.sync.core.model;

import java.util.Objects;

/**
 * A field of the target project.
 */
public record TargetField(String name, TargetFieldType type, OptionSet options) {

    public TargetField {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        options = options != null ? options : OptionSet.empty();
    }

    public static TargetField text(String name) {
        return new TargetField(name, TargetFieldType.TEXT, OptionSet.empty());
    }

    public static TargetField number(String name) {
        return new TargetField(name, TargetFieldType.NUMBER, OptionSet.empty());
    }

    public static TargetField singleSelect(String name, String... options) {
        return new TargetField(name, TargetFieldType.SINGLE_SELECT, OptionSet.of(options));
    }

    public static TargetField iteration(String name, String... iterations) {
        return new TargetField(name, TargetFieldType.ITERATION, OptionSet.of(iterations));
    }

    public boolean hasOptions() {
        return type.hasOptions();
    }
}
