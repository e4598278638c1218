package com.tracker.sync.adapter.memory;

import com.tracker.sync.adapter.TargetAdapter;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.core.model.FieldDiff;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.TargetField;
import com.tracker.sync.core.model.TargetItem;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.core.model.TargetSchema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Project board held in memory. New items land at the bottom and moves follow the
 * same after-item semantics as a hosted project board.
 */
public class InMemoryTargetAdapter implements TargetAdapter {

    private final TargetSchema schema;
    private final List<Entry> board = new ArrayList<>();
    private final Map<IssueKey, String> bodies = new HashMap<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();

    public InMemoryTargetAdapter(TargetSchema schema) {
        this.schema = schema;
    }

    @Override
    public TargetSchema listFieldSchema() {
        return schema;
    }

    @Override
    public synchronized List<TargetItem> listItems() {
        List<TargetItem> items = new ArrayList<>();
        for (int i = 0; i < board.size(); i++) {
            Entry e = board.get(i);
            String body = e.key != null ? bodies.getOrDefault(e.key, "") : null;
            items.add(new TargetItem(e.itemId, e.key, e.fields, body, i));
        }
        return items;
    }

    @Override
    public synchronized String createItem(TargetPayload payload) {
        writes.incrementAndGet();
        return append(payload.getKey(), Map.of());
    }

    @Override
    public synchronized void updateFields(String itemId, IssueKey key, List<FieldDiff> diffs) {
        Entry entry = find(itemId);
        for (FieldDiff diff : diffs) {
            TargetField field = schema.field(diff.field())
                    .orElseThrow(() -> new TrackerException("Unknown field '" + diff.field() + "'"));
            if (diff.to() == null) {
                entry.fields.remove(diff.field());
            } else if (field.hasOptions() && field.options().indexOf(diff.to()) < 0) {
                throw new TrackerException("'" + diff.to() + "' is not an option of '" + diff.field() + "'");
            } else {
                entry.fields.put(diff.field(), diff.to());
            }
        }
        writes.incrementAndGet();
    }

    @Override
    public synchronized Optional<String> readBody(IssueKey key) {
        return Optional.of(bodies.getOrDefault(key, ""));
    }

    @Override
    public synchronized void updateBody(IssueKey key, String body) {
        bodies.put(key, body);
        writes.incrementAndGet();
    }

    @Override
    public synchronized void moveItem(String itemId, String afterItemId) {
        Entry entry = find(itemId);
        board.remove(entry);
        if (afterItemId == null) {
            board.add(0, entry);
        } else {
            board.add(board.indexOf(find(afterItemId)) + 1, entry);
        }
        writes.incrementAndGet();
    }

    @Override
    public synchronized void removeItem(String itemId, IssueKey key) {
        board.remove(find(itemId));
        writes.incrementAndGet();
    }

    /**
     * Seeds an item without counting it as a write.
     */
    public synchronized String addItem(IssueKey key, Map<String, String> fields) {
        return append(key, fields);
    }

    public synchronized String addDraft() {
        return append(null, Map.of());
    }

    public synchronized void putBody(IssueKey key, String body) {
        bodies.put(key, body);
    }

    public synchronized String body(IssueKey key) {
        return bodies.get(key);
    }

    /**
     * Number of mutating calls received so far.
     */
    public int getWriteCount() {
        return writes.get();
    }

    private String append(IssueKey key, Map<String, String> fields) {
        String itemId = "item-" + ids.incrementAndGet();
        board.add(new Entry(itemId, key, new LinkedHashMap<>(fields)));
        return itemId;
    }

    private Entry find(String itemId) {
        for (Entry e : board) {
            if (e.itemId.equals(itemId)) {
                return e;
            }
        }
        throw new TrackerException("No item '" + itemId + "'");
    }

    private static final class Entry {
        final String itemId;
        final IssueKey key;
        final Map<String, String> fields;

        Entry(String itemId, IssueKey key, Map<String, String> fields) {
            this.itemId = itemId;
            this.key = key;
            this.fields = fields;
        }
    }
}
