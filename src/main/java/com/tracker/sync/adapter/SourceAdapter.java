package com.tracker.sync.adapter;

import com.tracker.sync.core.model.CanonicalField;

import java.util.List;
import java.util.Optional;

/**
 * Read access to a source tracker.
 *
 * <p>Calls may throw {@link TransientIOException} for failures worth retrying and
 * {@link TrackerException} for everything else.</p>
 */
public interface SourceAdapter {

    /**
     * Names of every workspace visible to the caller, most recently viewed first.
     */
    List<String> listSources();

    /**
     * Every issue and pull request currently on the workspace board.
     *
     * @param sourceId workspace name as returned by {@link #listSources()}
     */
    List<RawItem> fetchWorkspace(String sourceId);

    /**
     * The ordered value scale the source uses for {@code field}, lowest first, when known.
     */
    default Optional<List<String>> listOrderedScaleLabels(CanonicalField field) {
        return Optional.empty();
    }
}
