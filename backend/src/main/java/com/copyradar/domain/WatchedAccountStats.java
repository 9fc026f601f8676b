package com.copyradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Lifetime counters per watched account. firstTradeAt &lt;= lastTradeAt once a trade exists,
 * regardless of delivery order.
 */
@NoArgsConstructor
@Getter
@Setter
public class WatchedAccountStats {

    private String accountAddress;
    private String accountName;
    private String chain;
    private long totalTrades;
    private Instant firstTradeAt;
    private Instant lastTradeAt;

    public WatchedAccountStats(String accountAddress, String accountName, String chain) {
        this.accountAddress = accountAddress;
        this.accountName = accountName;
        this.chain = chain;
    }

    public void accumulate(Trade trade) {
        totalTrades++;
        Instant ts = trade.timestamp();
        if (firstTradeAt == null || ts.isBefore(firstTradeAt)) {
            firstTradeAt = ts;
        }
        if (lastTradeAt == null || ts.isAfter(lastTradeAt)) {
            lastTradeAt = ts;
        }
    }

    public WatchedAccountStats copy() {
        WatchedAccountStats copy = new WatchedAccountStats(accountAddress, accountName, chain);
        copy.totalTrades = totalTrades;
        copy.firstTradeAt = firstTradeAt;
        copy.lastTradeAt = lastTradeAt;
        return copy;
    }
}
