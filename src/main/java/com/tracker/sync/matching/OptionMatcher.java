package com.tracker.sync.matching;

import com.tracker.sync.core.model.OptionSet;
import com.tracker.sync.similarity.CompositeSimilarity;
import com.tracker.sync.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a source value into one of a destination field's ordered options.
 *
 * <p>Pure and deterministic: ties always go to the earliest option.</p>
 */
public class OptionMatcher {
    private static final Logger log = LoggerFactory.getLogger(OptionMatcher.class);

    private final SimilarityAlgorithm similarity;
    private final OptionSet defaultScale;

    public OptionMatcher() {
        this(new CompositeSimilarity(), DefaultScales.STORY_POINTS);
    }

    public OptionMatcher(SimilarityAlgorithm similarity) {
        this(similarity, DefaultScales.STORY_POINTS);
    }

    public OptionMatcher(SimilarityAlgorithm similarity, OptionSet defaultScale) {
        this.similarity = similarity;
        this.defaultScale = defaultScale;
    }

    /**
     * Matches a value with EXACT or CLOSEST. SCALE without a source scale uses the default scale.
     */
    public OptionMatch match(String value, OptionSet options, MatchStrategy strategy) {
        return match(value, options, strategy, null);
    }

    /**
     * Matches a value into {@code options}.
     *
     * @param value       source value
     * @param options     destination options, in order
     * @param strategy    translation strategy
     * @param sourceScale the source's own ordered labels for SCALE, or null when unavailable
     */
    public OptionMatch match(String value, OptionSet options, MatchStrategy strategy, OptionSet sourceScale) {
        if (options == null || options.isEmpty()) {
            return OptionMatch.noOptions();
        }
        if (value == null || value.isBlank()) {
            return OptionMatch.noMatch();
        }
        MatchStrategy effective = strategy != null ? strategy : MatchStrategy.DEFAULT;
        switch (effective) {
            case EXACT:
                return exact(value, options);
            case SCALE:
                return scale(value, sourceScale, options);
            case CLOSEST:
            default:
                return closest(value, options);
        }
    }

    private OptionMatch exact(String value, OptionSet options) {
        return options.find(value.trim())
                .map(label -> OptionMatch.matched(label, 1.0))
                .orElseGet(OptionMatch::noMatch);
    }

    private OptionMatch closest(String value, OptionSet options) {
        String wanted = value.trim();
        int exact = options.indexOf(wanted);
        if (exact >= 0) {
            return OptionMatch.matched(options.get(exact), 1.0);
        }

        List<Double> numbers = numericLabels(options);
        Double numericValue = parseNumber(wanted);
        boolean numeric = numbers != null && numericValue != null;

        int best = 0;
        double bestScore = -1.0;
        for (int i = 0; i < options.size(); i++) {
            double score = numeric
                    ? 1.0 / (1.0 + Math.abs(numbers.get(i) - numericValue))
                    : similarity.compute(wanted, options.get(i));
            if (score > bestScore) {
                best = i;
                bestScore = score;
            }
        }
        log.debug("option.closest value='{}' chosen='{}' score={}", wanted, options.get(best), bestScore);
        return OptionMatch.matched(options.get(best), Math.max(0.0, Math.min(1.0, bestScore)));
    }

    private OptionMatch scale(String value, OptionSet sourceScale, OptionSet options) {
        OptionSet scale = sourceScale != null && !sourceScale.isEmpty() ? sourceScale : defaultScale;
        int sourceRank = scale.indexOf(value.trim());
        double confidence = 1.0;
        if (sourceRank < 0) {
            // Value is not on the scale: place it at the nearest step first.
            OptionMatch placed = closest(value, scale);
            sourceRank = scale.indexOf(placed.chosen());
            confidence = placed.confidence();
        }
        int destinationRank = rank(sourceRank, scale.size(), options.size());
        return OptionMatch.matched(options.get(destinationRank), confidence);
    }

    /**
     * Maps rank {@code i} of {@code n} onto {@code m} ranks over the common range [0, 1].
     */
    static int rank(int i, int n, int m) {
        if (n <= 1 || m <= 1) {
            return 0;
        }
        long r = Math.round((double) i / (n - 1) * (m - 1));
        return (int) Math.max(0, Math.min(m - 1, r));
    }

    private static List<Double> numericLabels(OptionSet options) {
        List<Double> numbers = new ArrayList<>(options.size());
        for (String label : options.labels()) {
            Double n = parseNumber(label);
            if (n == null) {
                return null;
            }
            numbers.add(n);
        }
        return numbers;
    }

    /**
     * Finite number in {@code s}, or null. NaN and infinities do not count as numbers.
     */
    private static Double parseNumber(String s) {
        try {
            double n = Double.parseDouble(s.trim());
            return Double.isFinite(n) ? n : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
