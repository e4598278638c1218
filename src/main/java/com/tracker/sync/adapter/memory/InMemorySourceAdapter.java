package com.tracker.sync.adapter.memory;

import com.tracker.sync.adapter.RawItem;
import com.tracker.sync.adapter.SourceAdapter;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.core.model.CanonicalField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source backed by fixed workspaces, listed in insertion order.
 */
public class InMemorySourceAdapter implements SourceAdapter {

    private final Map<String, List<RawItem>> workspaces;
    private final Map<CanonicalField, List<String>> scales;

    private InMemorySourceAdapter(Builder builder) {
        this.workspaces = new LinkedHashMap<>(builder.workspaces);
        this.scales = new EnumMap<>(builder.scales);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> listSources() {
        return List.copyOf(workspaces.keySet());
    }

    @Override
    public List<RawItem> fetchWorkspace(String sourceId) {
        List<RawItem> items = workspaces.get(sourceId);
        if (items == null) {
            throw new TrackerException("Unknown workspace '" + sourceId + "'");
        }
        return List.copyOf(items);
    }

    @Override
    public Optional<List<String>> listOrderedScaleLabels(CanonicalField field) {
        return Optional.ofNullable(scales.get(field));
    }

    public static class Builder {
        private final Map<String, List<RawItem>> workspaces = new LinkedHashMap<>();
        private final Map<CanonicalField, List<String>> scales = new EnumMap<>(CanonicalField.class);

        public Builder workspace(String name, List<RawItem> items) {
            this.workspaces.put(name, new ArrayList<>(items));
            return this;
        }

        public Builder scale(CanonicalField field, List<String> labels) {
            this.scales.put(field, List.copyOf(labels));
            return this;
        }

        public InMemorySourceAdapter build() {
            return new InMemorySourceAdapter(this);
        }
    }
}
