package com.copyradar.similarity;

import com.copyradar.domain.SimilarityEvent;

import java.util.List;

/**
 * Per reference/suspect summary of a similarity pass.
 */
public record SimilarityReport(
        String referenceAccount,
        String suspectAccount,
        int pairCount,
        int directionMatchCount,
        double meanScore,
        double maxScore
) {

    public static SimilarityReport of(String referenceAccount, String suspectAccount, List<SimilarityEvent> events) {
        int matches = 0;
        double sum = 0.0;
        double max = 0.0;
        for (SimilarityEvent event : events) {
            if (event.directionMatch()) {
                matches++;
            }
            sum += event.score();
            max = Math.max(max, event.score());
        }
        double mean = events.isEmpty() ? 0.0 : sum / events.size();
        return new SimilarityReport(referenceAccount, suspectAccount, events.size(), matches, mean, max);
    }

    /** Share of reported pairs that traded the same way; 0 when nothing was reported. */
    public double directionMatchRatio() {
        return pairCount == 0 ? 0.0 : (double) directionMatchCount / pairCount;
    }
}
