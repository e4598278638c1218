package com.tracker.sync.matching;

/**
 * Outcome of an option match.
 */
public enum MatchStatus {
    MATCHED,
    /** No acceptable option. Not an error; the caller leaves the field unset. */
    NO_MATCH,
    /** The destination has no options configured. The caller skips the field. */
    NO_OPTIONS
}
