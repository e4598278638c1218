package com.tracker.sync.relation;

import java.util.List;

/**
 * Output of {@link RelationEncoder}.
 *
 * @param checklistBlock   the regenerated block, empty when nothing renders
 * @param prLinkDirectives lines such as {@code fixes owner/repo#12} for the pull request's own body
 */
public record EncodedRelations(String checklistBlock, List<String> prLinkDirectives) {

    public EncodedRelations {
        checklistBlock = checklistBlock != null ? checklistBlock : "";
        prLinkDirectives = prLinkDirectives != null ? List.copyOf(prLinkDirectives) : List.of();
    }

    public boolean hasBlock() {
        return !checklistBlock.isEmpty();
    }
}
