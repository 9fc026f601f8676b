package com.copyradar.similarity;

/**
 * Component weights of the similarity score. Non-negative, summing to 1 so the score stays within [0, 1].
 */
public record SimilarityWeights(double direction, double proximity, double size) {

    private static final double SUM_TOLERANCE = 1e-9;

    public static final SimilarityWeights DEFAULT = new SimilarityWeights(0.5, 0.3, 0.2);

    public SimilarityWeights {
        if (direction < 0 || proximity < 0 || size < 0) {
            throw new IllegalArgumentException("Similarity weights must be non-negative");
        }
        double sum = direction + proximity + size;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Similarity weights must sum to 1 but sum to " + sum);
        }
    }
}
