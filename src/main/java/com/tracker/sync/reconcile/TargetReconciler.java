package com.tracker.sync.reconcile;

import com.tracker.sync.core.model.Action;
import com.tracker.sync.core.model.FieldDiff;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.PositionChange;
import com.tracker.sync.core.model.TargetItem;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.relation.BodyBlocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Diffs the desired payloads against the current target items and produces the
 * smallest set of actions that makes the target match.
 *
 * <p>Planning is pure. Fields a payload does not carry are never touched, and an issue
 * whose current state already matches produces no action, so planning twice against an
 * unchanged target yields an empty plan.</p>
 *
 * <p>Position is compared by predecessor: an item moves only when the managed item
 * directly above it in its status column is not the one the sources order it after.</p>
 */
public class TargetReconciler {
    private static final Logger log = LoggerFactory.getLogger(TargetReconciler.class);

    public static final String DEFAULT_STATUS_FIELD = "Status";

    private final boolean removeDisabled;
    private final String statusField;
    private final ActionApplier applier;

    private TargetReconciler(Builder builder) {
        this.removeDisabled = builder.removeDisabled;
        this.statusField = builder.statusField;
        this.applier = builder.applier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Plans the changes for board payloads only.
     */
    public ReconciliationPlan reconcile(Collection<TargetPayload> payloads, List<TargetItem> currentItems) {
        return reconcile(payloads, List.of(), currentItems, Map.of());
    }

    /**
     * Plans the changes.
     *
     * @param payloads       desired board items
     * @param offBoard       issues kept off the board whose bodies and directives are still managed
     * @param currentItems   target items in board order
     * @param offBoardBodies current body of each off-board issue that could be read; issues missing
     *                       here get neither a body edit nor directives
     */
    public ReconciliationPlan reconcile(Collection<TargetPayload> payloads, Collection<TargetPayload> offBoard,
                                        List<TargetItem> currentItems, Map<IssueKey, String> offBoardBodies) {
        Map<IssueKey, TargetItem> byKey = new HashMap<>();
        List<TargetItem> duplicates = new ArrayList<>();
        List<TargetItem> drafts = new ArrayList<>();
        for (TargetItem item : currentItems) {
            if (item.isDraft()) {
                drafts.add(item);
            } else if (byKey.putIfAbsent(item.key(), item) != null) {
                duplicates.add(item);
            }
        }

        Map<IssueKey, TargetPayload> wanted = new TreeMap<>();
        for (TargetPayload payload : payloads) {
            wanted.put(payload.getKey(), payload);
        }

        Map<IssueKey, PositionChange> moves = new HashMap<>();
        List<IssueKey> moveOrder = planMoves(wanted, byKey, currentItems, moves);

        List<Action> changes = new ArrayList<>();
        for (TargetPayload payload : wanted.values()) {
            TargetItem item = byKey.get(payload.getKey());
            PositionChange move = moves.get(payload.getKey());
            if (item == null) {
                changes.add(Action.create(payload, createDiffs(payload), null, move));
                continue;
            }
            List<FieldDiff> diffs = fieldDiffs(payload, item);
            String body = bodyChange(payload, item);
            if (!diffs.isEmpty() || body != null || move != null) {
                changes.add(Action.update(item, payload, diffs, body, move));
            }
        }
        for (TargetPayload payload : offBoard) {
            if (!payload.managesBody() || wanted.containsKey(payload.getKey())) {
                continue;
            }
            String current = offBoardBodies.get(payload.getKey());
            if (current == null) {
                log.debug("reconcile.body.skipped issue={} reason=unreadable", payload.getKey());
                continue;
            }
            String updated = BodyBlocks.replace(current, payload.getBodyBlock());
            if (!updated.equals(current)) {
                changes.add(Action.editBody(payload, updated));
            }
        }
        changes.sort(Comparator.comparing(Action::key));

        List<Action> removes = new ArrayList<>();
        List<Notice> notices = new ArrayList<>();
        List<TargetItem> orphans = new ArrayList<>(duplicates);
        for (TargetItem item : byKey.values()) {
            if (!wanted.containsKey(item.key())) {
                orphans.add(item);
            }
        }
        orphans.sort(Comparator.comparing(TargetItem::key).thenComparing(TargetItem::itemId));
        for (TargetItem orphan : orphans) {
            if (removeDisabled) {
                notices.add(new Notice(NoticeType.ORPHANED_NOT_REMOVED, orphan.key(), orphan.itemId(),
                        "removal disabled"));
            } else {
                removes.add(Action.remove(orphan));
            }
        }
        drafts.sort(Comparator.comparing(TargetItem::itemId));
        for (TargetItem draft : drafts) {
            notices.add(new Notice(NoticeType.DRAFT_NOT_REMOVED, null, draft.itemId(), "draft item"));
        }

        Map<IssueKey, List<String>> directives = new TreeMap<>();
        for (TargetPayload payload : payloads) {
            TargetItem item = byKey.get(payload.getKey());
            addDirectives(payload, item != null ? item.body() : null, directives);
        }
        for (TargetPayload payload : offBoard) {
            String current = offBoardBodies.get(payload.getKey());
            if (current != null) {
                addDirectives(payload, current, directives);
            }
        }

        List<Action> actions = new ArrayList<>(changes);
        actions.addAll(removes);
        log.info("reconcile.planned actions={} removes={} moves={} notices={} directives={}",
                changes.size(), removes.size(), moveOrder.size(), notices.size(), directives.size());
        Map<IssueKey, String> itemIds = new HashMap<>();
        byKey.forEach((key, item) -> itemIds.put(key, item.itemId()));
        return new ReconciliationPlan(actions, notices, moveOrder, directives, itemIds);
    }

    /**
     * Applies a plan through the configured {@link ActionApplier}.
     */
    public ApplyResult apply(ReconciliationPlan plan) {
        if (applier == null) {
            throw new IllegalStateException("No action applier configured");
        }
        return applier.apply(plan);
    }

    private static List<FieldDiff> createDiffs(TargetPayload payload) {
        List<FieldDiff> diffs = new ArrayList<>();
        payload.getFields().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> diffs.add(new FieldDiff(e.getKey(), null, e.getValue())));
        return diffs;
    }

    private static List<FieldDiff> fieldDiffs(TargetPayload payload, TargetItem item) {
        List<FieldDiff> diffs = new ArrayList<>();
        payload.getFields().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> {
                    String current = item.field(e.getKey());
                    if (!Objects.equals(current, e.getValue())) {
                        diffs.add(new FieldDiff(e.getKey(), current, e.getValue()));
                    }
                });
        return diffs;
    }

    private static String bodyChange(TargetPayload payload, TargetItem item) {
        if (!payload.managesBody()) {
            return null;
        }
        String current = item.body() != null ? item.body() : "";
        String updated = BodyBlocks.replace(current, payload.getBodyBlock());
        return updated.equals(current) ? null : updated;
    }

    /**
     * Keeps the directives unless {@code currentBody} already carries every one of them. A null
     * body is not known yet, as for items about to be created.
     */
    private static void addDirectives(TargetPayload payload, String currentBody,
                                      Map<IssueKey, List<String>> directives) {
        List<String> lines = payload.getPullRequestDirectives();
        if (lines.isEmpty()) {
            return;
        }
        if (currentBody != null && BodyBlocks.insertMissingLines(currentBody, lines).equals(currentBody)) {
            return;
        }
        directives.put(payload.getKey(), lines);
    }

    /**
     * Works out which position-managed items need a move and the order to apply them in.
     */
    private List<IssueKey> planMoves(Map<IssueKey, TargetPayload> wanted, Map<IssueKey, TargetItem> byKey,
                                     List<TargetItem> currentItems, Map<IssueKey, PositionChange> moves) {
        Map<String, List<TargetPayload>> desiredColumns = new TreeMap<>();
        for (TargetPayload payload : wanted.values()) {
            if (payload.getPosition() != null) {
                String column = desiredColumn(payload, byKey.get(payload.getKey()));
                desiredColumns.computeIfAbsent(column, c -> new ArrayList<>()).add(payload);
            }
        }

        Map<IssueKey, IssueKey> currentPredecessor = new HashMap<>();
        Map<String, IssueKey> lastInColumn = new HashMap<>();
        List<TargetItem> ordered = new ArrayList<>(currentItems);
        ordered.sort(Comparator.comparingInt(TargetItem::position));
        for (TargetItem item : ordered) {
            if (item.isDraft() || byKey.get(item.key()) != item) {
                continue;
            }
            TargetPayload payload = wanted.get(item.key());
            if (payload == null || payload.getPosition() == null) {
                continue;
            }
            String column = columnOf(item);
            currentPredecessor.put(item.key(), lastInColumn.get(column));
            lastInColumn.put(column, item.key());
        }

        List<IssueKey> moveOrder = new ArrayList<>();
        for (Map.Entry<String, List<TargetPayload>> entry : desiredColumns.entrySet()) {
            List<TargetPayload> column = entry.getValue();
            column.sort(Comparator.comparing(TargetPayload::getPosition).thenComparing(TargetPayload::getKey));
            IssueKey previous = null;
            for (TargetPayload payload : column) {
                IssueKey key = payload.getKey();
                TargetItem item = byKey.get(key);
                boolean move = item == null
                        || !entry.getKey().equals(columnOf(item))
                        || !Objects.equals(currentPredecessor.get(key), previous);
                if (move) {
                    moves.put(key, new PositionChange(previous));
                    moveOrder.add(key);
                    log.debug("reconcile.move issue={} column='{}' after={}", key, entry.getKey(), previous);
                }
                previous = key;
            }
        }
        return moveOrder;
    }

    private String desiredColumn(TargetPayload payload, TargetItem item) {
        String status = payload.getFields().get(statusField);
        if (status == null && item != null) {
            status = item.field(statusField);
        }
        return status != null ? status : "";
    }

    private String columnOf(TargetItem item) {
        String status = item.field(statusField);
        return status != null ? status : "";
    }

    public boolean isRemoveDisabled() {
        return removeDisabled;
    }

    public String getStatusField() {
        return statusField;
    }

    public static class Builder {
        private boolean removeDisabled;
        private String statusField = DEFAULT_STATUS_FIELD;
        private ActionApplier applier;

        public Builder removeDisabled(boolean removeDisabled) {
            this.removeDisabled = removeDisabled;
            return this;
        }

        public Builder statusField(String statusField) {
            this.statusField = statusField;
            return this;
        }

        public Builder applier(ActionApplier applier) {
            this.applier = applier;
            return this;
        }

        public TargetReconciler build() {
            Objects.requireNonNull(statusField, "statusField is required");
            return new TargetReconciler(this);
        }
    }
}
