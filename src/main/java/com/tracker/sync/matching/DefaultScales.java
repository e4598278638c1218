package com.tracker.sync.matching;

import com.tracker.sync.core.model.OptionSet;

/**
 * Scales assumed when a source cannot report its own.
 */
public final class DefaultScales {

    /**
     * Fibonacci-style story points, smallest first. The source API does not expose the
     * workspace's estimate scale, so this is an approximation.
     */
    public static final OptionSet STORY_POINTS = OptionSet.of("1", "2", "3", "5", "8", "13", "21", "40");

    private DefaultScales() {
    }
}
