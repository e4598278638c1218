package com.tracker.sync.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fields of the target project, by name.
 */
public final class TargetSchema {

    private final Map<String, TargetField> fields;

    public TargetSchema(Collection<TargetField> fields) {
        Map<String, TargetField> byName = new LinkedHashMap<>();
        for (TargetField f : fields) {
            byName.put(f.name(), f);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public static TargetSchema of(TargetField... fields) {
        return new TargetSchema(List.of(fields));
    }

    public Optional<TargetField> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    public Collection<TargetField> fields() {
        return fields.values();
    }
}
