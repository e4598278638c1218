package com.tracker.sync.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * An item currently in the target project.
 *
 * @param itemId   the target's own item id
 * @param key      issue identity, null for draft items
 * @param fields   current field values by field name (option labels for single-select fields)
 * @param body     current body text of the issue, null when unknown
 * @param position ordinal of the item on the board (0-based)
 */
public record TargetItem(
        String itemId,
        IssueKey key,
        Map<String, String> fields,
        String body,
        int position
) {
    public TargetItem {
        Objects.requireNonNull(itemId, "itemId is required");
        fields = fields != null ? Map.copyOf(fields) : Map.of();
    }

    public boolean isDraft() {
        return key == null;
    }

    public String field(String name) {
        return fields.get(name);
    }
}
