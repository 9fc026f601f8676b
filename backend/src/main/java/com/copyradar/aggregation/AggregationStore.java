package com.copyradar.aggregation;

import com.copyradar.aggregation.AggregateKey.AccountActivityKey;
import com.copyradar.aggregation.AggregateKey.AccountStatsKey;
import com.copyradar.aggregation.AggregateKey.DailySummaryKey;
import com.copyradar.aggregation.lock.KeyedLockManager;
import com.copyradar.aggregation.lock.KeyedLockManager.LockHandle;
import com.copyradar.domain.AccountActivity;
import com.copyradar.domain.AccountActivityUpsertedEvent;
import com.copyradar.domain.DailySummary;
import com.copyradar.domain.DailySummaryUpsertedEvent;
import com.copyradar.domain.Trade;
import com.copyradar.domain.TradeId;
import com.copyradar.domain.WatchedAccountStats;
import com.copyradar.domain.WatchedAccountStatsUpsertedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Idempotent, concurrency-safe rollups: daily summary per (date, chain), account activity per
 * (account, date) and lifetime stats per account.
 * <p>
 * One trade touches exactly three keys. Their locks are taken in fixed order, the new state of each is computed
 * on a copy, and the copies replace the stored instances only once all three are ready. Stored instances are
 * never mutated after publication, so readers need no lock. Upsert events go out after the commit while the locks
 * are still held, so listeners see each key's snapshots in commit order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AggregationStore {

    private final KeyedLockManager lockManager;
    private final AppliedTradeLedger appliedLedger;
    private final ApplicationEventPublisher eventPublisher;

    private final ConcurrentMap<DailySummaryKey, DailySummary> dailySummaries = new ConcurrentHashMap<>();
    private final ConcurrentMap<AccountActivityKey, AccountActivity> accountActivities = new ConcurrentHashMap<>();
    private final ConcurrentMap<AccountStatsKey, WatchedAccountStats> accountStats = new ConcurrentHashMap<>();

    /**
     * Applies one trade to its three aggregates. A trade id already recorded for a key leaves that key unchanged.
     *
     * @throws AggregateLockTimeoutException when a key lock cannot be acquired; no aggregate is changed
     */
    public AggregationResult apply(Trade trade) {
        DailySummaryKey dailyKey = DailySummaryKey.of(trade);
        AccountActivityKey activityKey = AccountActivityKey.of(trade);
        AccountStatsKey statsKey = AccountStatsKey.of(trade);
        TradeId tradeId = trade.id();

        AggregationResult result;
        try (LockHandle ignored = lockManager.acquireAll(List.of(dailyKey, activityKey, statsKey))) {
            boolean applyDaily = !appliedLedger.isApplied(dailyKey, tradeId);
            boolean applyActivity = !appliedLedger.isApplied(activityKey, tradeId);
            boolean applyStats = !appliedLedger.isApplied(statsKey, tradeId);

            DailySummary daily = nextDaily(dailyKey, trade, applyDaily);
            AccountActivity activity = nextActivity(activityKey, trade, applyActivity);
            WatchedAccountStats stats = nextStats(statsKey, trade, applyStats);

            if (applyDaily) {
                dailySummaries.put(dailyKey, daily);
                appliedLedger.markApplied(dailyKey, tradeId);
            }
            if (applyActivity) {
                accountActivities.put(activityKey, activity);
                appliedLedger.markApplied(activityKey, tradeId);
            }
            if (applyStats) {
                accountStats.put(statsKey, stats);
                appliedLedger.markApplied(statsKey, tradeId);
            }
            result = new AggregationResult(daily.copy(), activity.copy(), stats.copy(),
                    applyDaily, applyActivity, applyStats);
            // Still under the key locks: upserts for one key reach listeners in commit order.
            publishUpserts(result);
        }

        if (!result.anyApplied()) {
            log.debug("Trade {} already aggregated; skipped", tradeId);
        }
        return result;
    }

    private DailySummary nextDaily(DailySummaryKey key, Trade trade, boolean apply) {
        DailySummary current = dailySummaries.get(key);
        DailySummary next = current != null ? current.copy() : new DailySummary(key.date(), key.chain());
        if (apply) {
            next.accumulate(trade);
        }
        return next;
    }

    private AccountActivity nextActivity(AccountActivityKey key, Trade trade, boolean apply) {
        AccountActivity current = accountActivities.get(key);
        AccountActivity next = current != null
                ? current.copy()
                : new AccountActivity(key.accountAddress(), trade.accountName(), key.date(), trade.chain());
        if (apply) {
            next.accumulate(trade);
        }
        return next;
    }

    private WatchedAccountStats nextStats(AccountStatsKey key, Trade trade, boolean apply) {
        WatchedAccountStats current = accountStats.get(key);
        WatchedAccountStats next = current != null
                ? current.copy()
                : new WatchedAccountStats(key.accountAddress(), trade.accountName(), trade.chain());
        if (apply) {
            next.accumulate(trade);
        }
        return next;
    }

    private void publishUpserts(AggregationResult result) {
        if (result.dailySummaryApplied()) {
            eventPublisher.publishEvent(new DailySummaryUpsertedEvent(result.dailySummary()));
        }
        if (result.accountActivityApplied()) {
            eventPublisher.publishEvent(new AccountActivityUpsertedEvent(result.accountActivity()));
        }
        if (result.watchedAccountStatsApplied()) {
            eventPublisher.publishEvent(new WatchedAccountStatsUpsertedEvent(result.watchedAccountStats()));
        }
    }

    public Optional<DailySummary> getDailySummary(LocalDate date, String chain) {
        return Optional.ofNullable(dailySummaries.get(new DailySummaryKey(date, chain))).map(DailySummary::copy);
    }

    public Optional<AccountActivity> getAccountActivity(String accountAddress, LocalDate date) {
        return Optional.ofNullable(accountActivities.get(new AccountActivityKey(accountAddress, date)))
                .map(AccountActivity::copy);
    }

    public Optional<WatchedAccountStats> getWatchedAccountStats(String accountAddress) {
        return Optional.ofNullable(accountStats.get(new AccountStatsKey(accountAddress)))
                .map(WatchedAccountStats::copy);
    }

    /**
     * Drops every aggregate and applied mark. Used on reference-data reload; callers must not apply concurrently.
     */
    public void reset() {
        dailySummaries.clear();
        accountActivities.clear();
        accountStats.clear();
        appliedLedger.clear();
        lockManager.clear();
        log.info("Aggregation state reset");
    }
}
