package com.tracker.sync.similarity;

/**
 * Weights of the two scores combined by {@link CompositeSimilarity}.
 */
public record SimilarityWeights(double editDistanceWeight, double tokenOverlapWeight) {

    public SimilarityWeights {
        if (editDistanceWeight < 0 || tokenOverlapWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = editDistanceWeight + tokenOverlapWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Edit distance dominates; token overlap rescues reordered multi-word labels.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.7, 0.3);
    }

    public static SimilarityWeights editDistanceOnly() {
        return new SimilarityWeights(1.0, 0.0);
    }
}
