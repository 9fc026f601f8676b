package com.copyradar.domain;

/**
 * Application event: lifetime stats of a watched account were created or mutated (detached snapshot).
 */
public record WatchedAccountStatsUpsertedEvent(WatchedAccountStats stats) {
}
