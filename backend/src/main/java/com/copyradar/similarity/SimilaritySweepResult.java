package com.copyradar.similarity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of comparing one reference account with the other watched accounts. {@code cancelled} is true when
 * the sweep stopped early; {@code reports} then holds only the pairs finished before that.
 */
public record SimilaritySweepResult(String referenceAccount, Map<String, SimilarityReport> reports, boolean cancelled) {

    public SimilaritySweepResult {
        reports = Collections.unmodifiableMap(new LinkedHashMap<>(reports));
    }
}
