package com.tracker.sync.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered option labels of a single-select field. Order matters for rank-based matching.
 */
public record OptionSet(List<String> labels) {

    public OptionSet {
        labels = labels != null ? List.copyOf(labels) : List.of();
    }

    public static OptionSet of(String... labels) {
        return new OptionSet(List.of(labels));
    }

    public static OptionSet empty() {
        return new OptionSet(List.of());
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public int size() {
        return labels.size();
    }

    public String get(int rank) {
        return labels.get(rank);
    }

    /**
     * Case-insensitive position of a label, or -1.
     */
    public int indexOf(String label) {
        if (label == null) {
            return -1;
        }
        String wanted = label.toLowerCase(Locale.ROOT);
        for (int i = 0; i < labels.size(); i++) {
            if (labels.get(i).toLowerCase(Locale.ROOT).equals(wanted)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<String> find(String label) {
        int i = indexOf(label);
        return i < 0 ? Optional.empty() : Optional.of(labels.get(i));
    }
}
