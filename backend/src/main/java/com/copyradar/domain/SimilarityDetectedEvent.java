package com.copyradar.domain;

import java.util.List;

/**
 * Application event: a similarity scan found matching pairs between a reference and a suspect account.
 */
public record SimilarityDetectedEvent(String referenceAccount, String suspectAccount, List<SimilarityEvent> events) {

    public SimilarityDetectedEvent {
        events = List.copyOf(events);
    }
}
