package com.tracker.sync.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One reconciler output.
 *
 * @param type     create, update or remove
 * @param key      issue identity (null only when removing a draft item)
 * @param itemId   target item id, null for creates
 * @param payload  desired state, null for removes
 * @param diffs    changed fields, empty for removes
 * @param body     full new body when the body changed, otherwise null; creates work out the
 *                 body when applied
 * @param position placement to apply after all field changes, or null
 */
public record Action(
        ActionType type,
        IssueKey key,
        String itemId,
        TargetPayload payload,
        List<FieldDiff> diffs,
        String body,
        PositionChange position
) {
    public Action {
        Objects.requireNonNull(type, "type is required");
        diffs = diffs != null ? List.copyOf(diffs) : List.of();
    }

    public static Action create(TargetPayload payload, List<FieldDiff> diffs, String body, PositionChange position) {
        return new Action(ActionType.CREATE, payload.getKey(), null, payload, diffs, body, position);
    }

    public static Action update(TargetItem item, TargetPayload payload, List<FieldDiff> diffs,
                                String body, PositionChange position) {
        return new Action(ActionType.UPDATE, item.key(), item.itemId(), payload, diffs, body, position);
    }

    /**
     * Rewrites the body of an issue that has no board item.
     */
    public static Action editBody(TargetPayload payload, String body) {
        Objects.requireNonNull(body, "body is required");
        return new Action(ActionType.EDIT_BODY, payload.getKey(), null, payload, List.of(), body, null);
    }

    public static Action remove(TargetItem item) {
        return new Action(ActionType.REMOVE, item.key(), item.itemId(), null, List.of(), null, null);
    }

    public boolean changesBody() {
        return body != null;
    }

    public boolean movesItem() {
        return position != null;
    }

    /**
     * Stable one-line description, identical for identical actions.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder().append(type).append(' ').append(key);
        if (!diffs.isEmpty()) {
            sb.append(" fields=").append(diffs);
        }
        if (body != null) {
            sb.append(" body=").append(body.length()).append(" chars");
        }
        if (position != null) {
            sb.append(" position=").append(position);
        }
        return sb.toString();
    }
}
