package com.copyradar.domain;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Daily rollup across all watched accounts, keyed by (date, chain).
 * Invariants: buyCount + sellCount == totalTransactions; totalVolume == buy + sell per asset.
 */
@NoArgsConstructor
@Getter
@Setter
public class DailySummary extends TradeVolumeTally {

    private LocalDate date;
    private String chain;
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Set<String> accountAddresses = new TreeSet<>();
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Set<String> poolIds = new TreeSet<>();

    public DailySummary(LocalDate date, String chain) {
        this.date = date;
        this.chain = chain;
    }

    /** Storage id, e.g. {@code 2025-01-15-ethereum-mainnet}. */
    public String getId() {
        return date + "-" + chain;
    }

    @Override
    public void accumulate(Trade trade) {
        super.accumulate(trade);
        accountAddresses.add(trade.accountAddress());
        poolIds.add(trade.poolId());
    }

    public int getUniqueAccounts() {
        return accountAddresses.size();
    }

    public int getUniquePools() {
        return poolIds.size();
    }

    public Set<String> getAccountAddresses() {
        return Collections.unmodifiableSet(accountAddresses);
    }

    public Set<String> getPoolIds() {
        return Collections.unmodifiableSet(poolIds);
    }

    /** Detached copy; the store never hands out the instance it accumulates into. */
    public DailySummary copy() {
        DailySummary copy = new DailySummary(date, chain);
        copyTallyInto(copy);
        copy.accountAddresses = new TreeSet<>(accountAddresses);
        copy.poolIds = new TreeSet<>(poolIds);
        return copy;
    }
}
