package com.copyradar.aggregation;

import com.copyradar.domain.TradeId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;

/**
 * Remembers which trade ids were already applied to which aggregate key, within a bounded retention window
 * (Caffeine: expire-after-write plus a size cap). Redelivery inside the window is detected per key.
 */
public class AppliedTradeLedger {

    private record Mark(AggregateKey key, TradeId tradeId) {
    }

    private final Cache<Mark, Boolean> marks;

    public AppliedTradeLedger(Duration retention, long maxEntries) {
        this.marks = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maxEntries)
                .build();
    }

    public boolean isApplied(AggregateKey key, TradeId tradeId) {
        return marks.getIfPresent(new Mark(key, tradeId)) != null;
    }

    public void markApplied(AggregateKey key, TradeId tradeId) {
        marks.put(new Mark(key, tradeId), Boolean.TRUE);
    }

    public void clear() {
        marks.invalidateAll();
    }
}
