package com.tracker.sync.merge;

import com.tracker.sync.core.model.IssueKey;

import java.util.List;

/**
 * Several records of one source claimed the same issue key with different identities.
 * The issue is skipped for the pass.
 */
public record IdentityConflict(IssueKey key, String sourceId, List<String> externalIds) {

    public IdentityConflict {
        externalIds = externalIds != null ? List.copyOf(externalIds) : List.of();
    }
}
