package com.copyradar.aggregation.history;

import com.copyradar.aggregation.config.AggregationProperties;
import com.copyradar.domain.Trade;
import com.copyradar.domain.TradeId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-account trade sequences ordered by (timestamp, block, log index, tx hash), the input of similarity scans
 * and performance summaries. Recording a trade id twice is a no-op, including ids already evicted by the
 * per-account cap while they are still within the applied-retention window.
 */
@Component
@Slf4j
public class TradeHistoryStore {

    static final Comparator<Trade> TRADE_ORDER = Comparator.comparing(Trade::timestamp)
            .thenComparingLong(Trade::blockNumber)
            .thenComparingLong(Trade::logIndex)
            .thenComparing(Trade::transactionHash);

    private final ConcurrentMap<String, AccountHistory> histories = new ConcurrentHashMap<>();
    private final int maxTradesPerAccount;
    private final Cache<TradeId, Boolean> evictedIds;

    public TradeHistoryStore(AggregationProperties properties) {
        this.maxTradesPerAccount = properties.getMaxTradesPerAccount();
        this.evictedIds = Caffeine.newBuilder()
                .expireAfterWrite(properties.getAppliedRetention())
                .maximumSize(properties.getAppliedMaxEntries())
                .build();
    }

    /**
     * @return true when the trade was new for its account
     */
    public boolean record(Trade trade) {
        if (evictedIds.getIfPresent(trade.id()) != null) {
            log.debug("Trade {} was evicted from history; not recorded again", trade.id());
            return false;
        }
        AccountHistory history = histories.computeIfAbsent(trade.accountAddress(), a -> new AccountHistory());
        return history.add(trade, maxTradesPerAccount, evictedIds);
    }

    /** Immutable, time-ordered copy; empty for unknown accounts. */
    public List<Trade> snapshot(String accountAddress) {
        AccountHistory history = histories.get(accountAddress);
        return history == null ? List.of() : history.snapshot();
    }

    /** Trades with from &lt;= timestamp &lt;= to. */
    public List<Trade> snapshot(String accountAddress, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return snapshot(accountAddress).stream()
                .filter(t -> !t.timestamp().isBefore(from) && !t.timestamp().isAfter(to))
                .toList();
    }

    public Set<String> accounts() {
        return Set.copyOf(histories.keySet());
    }

    public void clear() {
        histories.clear();
        evictedIds.invalidateAll();
    }

    private static final class AccountHistory {

        private final TreeMap<Trade, Trade> trades = new TreeMap<>(TRADE_ORDER);
        private final Set<TradeId> ids = new HashSet<>();

        synchronized boolean add(Trade trade, int cap, Cache<TradeId, Boolean> evictedIds) {
            if (!ids.add(trade.id())) {
                log.debug("Trade {} already in history", trade.id());
                return false;
            }
            trades.put(trade, trade);
            if (cap > 0) {
                while (trades.size() > cap) {
                    Map.Entry<Trade, Trade> oldest = trades.pollFirstEntry();
                    ids.remove(oldest.getKey().id());
                    evictedIds.put(oldest.getKey().id(), Boolean.TRUE);
                }
            }
            return true;
        }

        synchronized List<Trade> snapshot() {
            return List.copyOf(trades.values());
        }
    }
}
