package com.copyradar.domain;

/**
 * Application event: per-account daily activity was created or mutated (detached snapshot).
 */
public record AccountActivityUpsertedEvent(AccountActivity activity) {
}
