package com.tracker.sync.adapter;

import com.tracker.sync.core.model.FieldDiff;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.TargetItem;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.core.model.TargetSchema;
import com.tracker.sync.relation.BodyBlocks;

import java.util.List;
import java.util.Optional;

/**
 * Read and write access to the target project.
 *
 * <p>Calls may throw {@link TransientIOException} for failures worth retrying and
 * {@link TrackerException} for everything else.</p>
 */
public interface TargetAdapter {

    /**
     * Fields of the project with their options.
     */
    TargetSchema listFieldSchema();

    /**
     * Every item of the project in board order, bodies included.
     */
    List<TargetItem> listItems();

    /**
     * Adds the issue to the project.
     *
     * @return the new item id; field values, body and position follow as separate calls
     */
    String createItem(TargetPayload payload);

    /**
     * Sets or clears item field values. A diff with a null {@code to} clears the field.
     */
    void updateFields(String itemId, IssueKey key, List<FieldDiff> diffs);

    /**
     * Current body of an issue or pull request, empty when it does not exist.
     */
    Optional<String> readBody(IssueKey key);

    void updateBody(IssueKey key, String body);

    /**
     * Moves an item directly after another one, or to the top when {@code afterItemId} is null.
     */
    void moveItem(String itemId, String afterItemId);

    /**
     * Removes the item from the project. The issue itself is left alone.
     */
    void removeItem(String itemId, IssueKey key);

    /**
     * Adds the directives a pull request body is missing.
     *
     * @return true when the body changed
     */
    default boolean updatePullRequestBody(IssueKey pullRequest, List<String> directives) {
        Optional<String> body = readBody(pullRequest);
        if (body.isEmpty()) {
            return false;
        }
        String updated = BodyBlocks.insertMissingLines(body.get(), directives);
        if (updated.equals(body.get())) {
            return false;
        }
        updateBody(pullRequest, updated);
        return true;
    }
}
