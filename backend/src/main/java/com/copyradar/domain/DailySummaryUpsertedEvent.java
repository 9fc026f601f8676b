package com.copyradar.domain;

/**
 * Application event: a daily summary was created or mutated. Carries a detached snapshot for the storage layer.
 */
public record DailySummaryUpsertedEvent(DailySummary summary) {
}
