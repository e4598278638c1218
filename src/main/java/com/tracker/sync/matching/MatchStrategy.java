package com.tracker.sync.matching;

import java.util.Locale;
import java.util.Optional;

/**
 * How a source value is translated into one of a destination field's options.
 */
public enum MatchStrategy {
    /** Case-insensitive equality only. */
    EXACT,
    /** Most similar option label; never misses on a non-empty option set. */
    CLOSEST,
    /** Rank-to-rank mapping between two ordered scales. */
    SCALE;

    public static final MatchStrategy DEFAULT = CLOSEST;

    /**
     * Parses a strategy name case-insensitively; unknown or blank names are empty.
     */
    public static Optional<MatchStrategy> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
