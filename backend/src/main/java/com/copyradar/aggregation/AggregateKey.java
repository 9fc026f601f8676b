package com.copyradar.aggregation;

import com.copyradar.domain.Trade;

import java.time.LocalDate;

/**
 * Identity of one aggregate record; the unit of locking, idempotence and consistency.
 * Lock order across kinds is fixed by {@link #lockRank()}.
 */
public interface AggregateKey {

    /** Lower ranks are locked first. */
    int lockRank();

    record DailySummaryKey(LocalDate date, String chain) implements AggregateKey {

        public static DailySummaryKey of(Trade trade) {
            return new DailySummaryKey(trade.date(), trade.chain());
        }

        @Override
        public int lockRank() {
            return 0;
        }
    }

    record AccountActivityKey(String accountAddress, LocalDate date) implements AggregateKey {

        public static AccountActivityKey of(Trade trade) {
            return new AccountActivityKey(trade.accountAddress(), trade.date());
        }

        @Override
        public int lockRank() {
            return 1;
        }
    }

    record AccountStatsKey(String accountAddress) implements AggregateKey {

        public static AccountStatsKey of(Trade trade) {
            return new AccountStatsKey(trade.accountAddress());
        }

        @Override
        public int lockRank() {
            return 2;
        }
    }
}
