package com.tracker.sync.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard index over word tokens. Labels like "High Priority" and "Priority: High" score 1.0.
 */
public class TokenOverlapSimilarity implements SimilarityAlgorithm {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Punct}]+");

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> left = tokenize(s1);
        Set<String> right = tokenize(s2);
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty() && s1.equals(s2) ? 1.0 : 0.0;
        }

        int shared = 0;
        for (String token : left) {
            if (right.contains(token)) {
                shared++;
            }
        }
        return (double) shared / (left.size() + right.size() - shared);
    }

    @Override
    public String getName() {
        return "TokenOverlap";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : SEPARATORS.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
