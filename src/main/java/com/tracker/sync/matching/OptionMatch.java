package com.tracker.sync.matching;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of translating a value into a destination option.
 *
 * @param chosen     the chosen option label, null unless matched
 * @param confidence similarity (or 1.0 for exact and rank matches) in [0, 1]
 * @param status     match outcome
 */
public record OptionMatch(String chosen, double confidence, MatchStatus status) {

    private static final OptionMatch NO_MATCH = new OptionMatch(null, 0.0, MatchStatus.NO_MATCH);
    private static final OptionMatch NO_OPTIONS = new OptionMatch(null, 0.0, MatchStatus.NO_OPTIONS);

    public OptionMatch {
        Objects.requireNonNull(status, "status is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (status == MatchStatus.MATCHED && chosen == null) {
            throw new IllegalArgumentException("A match needs a chosen option");
        }
    }

    public static OptionMatch matched(String chosen, double confidence) {
        return new OptionMatch(chosen, confidence, MatchStatus.MATCHED);
    }

    public static OptionMatch noMatch() {
        return NO_MATCH;
    }

    public static OptionMatch noOptions() {
        return NO_OPTIONS;
    }

    public boolean isMatched() {
        return status == MatchStatus.MATCHED;
    }

    public Optional<String> value() {
        return Optional.ofNullable(chosen);
    }
}
