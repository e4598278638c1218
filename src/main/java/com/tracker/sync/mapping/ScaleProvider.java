package com.tracker.sync.mapping;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.OptionSet;

import java.util.Optional;

/**
 * Supplies a source's own ordered value scale for a field, when the source can report one.
 */
@FunctionalInterface
public interface ScaleProvider {

    Optional<OptionSet> scaleFor(CanonicalField field);

    /**
     * A provider that never knows the scale.
     */
    ScaleProvider NONE = field -> Optional.empty();
}
