package com.tracker.sync.normalize;

import com.tracker.sync.core.model.CanonicalField;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps source field names matching a pattern onto a canonical field.
 * Rules have priority ordering and can be scoped to specific sources.
 */
public class FieldAliasRule {
    private final String name;
    private final Pattern pattern;
    private final CanonicalField field;
    private final Set<String> applicableSources;
    private final int priority;

    private FieldAliasRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE);
        this.field = builder.field;
        this.applicableSources = builder.applicableSources != null ?
                Set.copyOf(builder.applicableSources) : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public CanonicalField getField() {
        return field;
    }

    public Set<String> getApplicableSources() {
        return applicableSources;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * A rule without sources applies to every source.
     */
    public boolean appliesTo(String sourceId) {
        return applicableSources.isEmpty() || applicableSources.contains(sourceId);
    }

    /**
     * True if the whole raw field name matches.
     */
    public boolean matches(String rawFieldName) {
        return rawFieldName != null && pattern.matcher(rawFieldName.trim()).matches();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldAliasRule that = (FieldAliasRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "FieldAliasRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", field=" + field +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private CanonicalField field;
        private Set<String> applicableSources;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder field(CanonicalField field) {
            this.field = field;
            return this;
        }

        public Builder applicableSources(String... sources) {
            this.applicableSources = Set.of(sources);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public FieldAliasRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(field, "field is required");
            return new FieldAliasRule(this);
        }
    }
}
