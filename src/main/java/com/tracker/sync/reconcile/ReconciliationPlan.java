package com.tracker.sync.reconcile;

import com.tracker.sync.core.model.Action;
import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.core.model.IssueKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a pass intends to change in the target.
 *
 * @param actions    creates, updates and body edits sorted by key, then removes sorted by key
 * @param notices    orphaned items kept in place
 * @param moveOrder  keys whose action moves the item, in the order moves must be applied
 * @param directives pull request link directives per pull request, sorted by key
 * @param itemIds    target item id of every issue already on the board
 */
public record ReconciliationPlan(
        List<Action> actions,
        List<Notice> notices,
        List<IssueKey> moveOrder,
        Map<IssueKey, List<String>> directives,
        Map<IssueKey, String> itemIds
) {
    public ReconciliationPlan {
        actions = actions != null ? List.copyOf(actions) : List.of();
        notices = notices != null ? List.copyOf(notices) : List.of();
        moveOrder = moveOrder != null ? List.copyOf(moveOrder) : List.of();
        directives = directives != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(directives)) : Map.of();
        itemIds = itemIds != null ? Map.copyOf(itemIds) : Map.of();
    }

    public ReconciliationPlan(List<Action> actions, List<Notice> notices, List<IssueKey> moveOrder,
                              Map<IssueKey, List<String>> directives) {
        this(actions, notices, moveOrder, directives, Map.of());
    }

    public static ReconciliationPlan empty() {
        return new ReconciliationPlan(List.of(), List.of(), List.of(), Map.of(), Map.of());
    }

    public List<Action> actionsOf(ActionType type) {
        return actions.stream().filter(a -> a.type() == type).toList();
    }

    public boolean isEmpty() {
        return actions.isEmpty() && directives.isEmpty();
    }
}
