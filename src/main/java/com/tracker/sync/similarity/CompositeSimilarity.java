package com.tracker.sync.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted sum of edit-distance and token-overlap similarity.
 */
public class CompositeSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarity.class);

    private final LevenshteinSimilarity editDistance = new LevenshteinSimilarity();
    private final TokenOverlapSimilarity tokenOverlap = new TokenOverlapSimilarity();
    private final SimilarityWeights weights;

    public CompositeSimilarity() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarity(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        double edit = editDistance.compute(s1, s2);
        double tokens = tokenOverlap.compute(s1, s2);
        double score = weights.editDistanceWeight() * edit + weights.tokenOverlapWeight() * tokens;
        log.trace("similarity '{}' vs '{}': edit={} tokens={} composite={}", s1, s2, edit, tokens, score);
        return Math.min(1.0, score);
    }

    @Override
    public String getName() {
        return "Composite";
    }

    public SimilarityWeights getWeights() {
        return weights;
    }
}
