package com.copyradar.reference;

/**
 * One consistent generation of reference data. Swapped as a whole on reload.
 */
public record ReferenceData(WatchedAccountRegistry watchedAccounts, PoolRegistry pools) {
}
