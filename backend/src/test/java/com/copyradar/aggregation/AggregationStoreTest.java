package com.copyradar.aggregation;

import com.copyradar.aggregation.AggregateKey.AccountStatsKey;
import com.copyradar.aggregation.lock.KeyedLockManager;
import com.copyradar.common.RetryPolicy;
import com.copyradar.domain.AccountActivity;
import com.copyradar.domain.AccountActivityUpsertedEvent;
import com.copyradar.domain.DailySummary;
import com.copyradar.domain.DailySummaryUpsertedEvent;
import com.copyradar.domain.Trade;
import com.copyradar.domain.WatchedAccountStats;
import com.copyradar.domain.WatchedAccountStatsUpsertedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.copyradar.domain.TradeFixtures.ACCOUNT_1;
import static com.copyradar.domain.TradeFixtures.ACCOUNT_2;
import static com.copyradar.domain.TradeFixtures.CHAIN;
import static com.copyradar.domain.TradeFixtures.buy;
import static com.copyradar.domain.TradeFixtures.sell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AggregationStoreTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);
    private static final Instant T0 = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private KeyedLockManager lockManager;
    private AggregationStore store;

    @BeforeEach
    void setUp() {
        lockManager = new KeyedLockManager(5_000L, new RetryPolicy(1L, 0, 3));
        store = new AggregationStore(lockManager, new AppliedTradeLedger(Duration.ofHours(24), 10_000), eventPublisher);
    }

    @Test
    void apply_firstTrade_createsAllThreeAggregates() {
        AggregationResult result = store.apply(buy(ACCOUNT_1, "2", "6000", T0, "0x01"));

        assertThat(result.dailySummaryApplied()).isTrue();
        assertThat(result.accountActivityApplied()).isTrue();
        assertThat(result.watchedAccountStatsApplied()).isTrue();

        DailySummary daily = store.getDailySummary(DAY, CHAIN).orElseThrow();
        assertThat(daily.getTotalTransactions()).isEqualTo(1);
        assertThat(daily.getBuyCount()).isEqualTo(1);
        assertThat(daily.getMinPrice()).isEqualByComparingTo("3000");
        assertThat(daily.getMaxPrice()).isEqualByComparingTo("3000");
        assertThat(daily.getUniqueAccounts()).isEqualTo(1);
        assertThat(daily.getId()).isEqualTo("2025-01-15-ethereum-mainnet");

        AccountActivity activity = store.getAccountActivity(ACCOUNT_1, DAY).orElseThrow();
        assertThat(activity.getTotalBuyBase()).isEqualByComparingTo("2");
        assertThat(activity.getNetBasePosition()).isEqualByComparingTo("2");

        WatchedAccountStats stats = store.getWatchedAccountStats(ACCOUNT_1).orElseThrow();
        assertThat(stats.getTotalTrades()).isEqualTo(1);
        assertThat(stats.getFirstTradeAt()).isEqualTo(T0);
        assertThat(stats.getLastTradeAt()).isEqualTo(T0);
    }

    @Test
    void apply_mixedTrades_countsAndVolumesConserved() {
        store.apply(buy(ACCOUNT_1, "2", "6000", T0, "0x01"));
        store.apply(sell(ACCOUNT_1, "1", "3100", T0.plusSeconds(60), "0x02"));
        store.apply(buy(ACCOUNT_2, "0.5", "1450", T0.plusSeconds(120), "0x03"));

        DailySummary daily = store.getDailySummary(DAY, CHAIN).orElseThrow();
        assertThat(daily.getBuyCount() + daily.getSellCount()).isEqualTo(daily.getTotalTransactions());
        assertThat(daily.getTotalTransactions()).isEqualTo(3);
        assertThat(daily.getTotalVolumeBase())
                .isEqualByComparingTo(daily.getTotalBuyBase().add(daily.getTotalSellBase()))
                .isEqualByComparingTo("3.5");
        assertThat(daily.getTotalVolumeQuote()).isEqualByComparingTo("10550");
        assertThat(daily.getMinPrice()).isEqualByComparingTo("2900");
        assertThat(daily.getMaxPrice()).isEqualByComparingTo("3100");
        assertThat(daily.getAvgBuyPrice()).isEqualByComparingTo("2980");
        assertThat(daily.getUniqueAccounts()).isEqualTo(2);

        AccountActivity activity = store.getAccountActivity(ACCOUNT_1, DAY).orElseThrow();
        assertThat(activity.getBuyCount() + activity.getSellCount()).isEqualTo(activity.getTotalTransactions());
        assertThat(activity.getNetBasePosition()).isEqualByComparingTo("1");
        assertThat(activity.getNetQuotePosition()).isEqualByComparingTo("-2900");
    }

    @Test
    @DisplayName("replaying the same trade leaves every aggregate unchanged")
    void apply_sameTradeTwice_isIdempotent() {
        Trade trade = buy(ACCOUNT_1, "2", "6000", T0, "0x01");
        store.apply(trade);

        AggregationResult replay = store.apply(trade);

        assertThat(replay.anyApplied()).isFalse();
        assertThat(replay.dailySummary().getTotalTransactions()).isEqualTo(1);
        assertThat(store.getDailySummary(DAY, CHAIN).orElseThrow().getTotalTransactions()).isEqualTo(1);
        assertThat(store.getAccountActivity(ACCOUNT_1, DAY).orElseThrow().getTotalTransactions()).isEqualTo(1);
        assertThat(store.getWatchedAccountStats(ACCOUNT_1).orElseThrow().getTotalTrades()).isEqualTo(1);
        verify(eventPublisher, times(1)).publishEvent(any(DailySummaryUpsertedEvent.class));
    }

    @Test
    void apply_publishesOneUpsertPerAggregate() {
        store.apply(buy(ACCOUNT_1, "2", "6000", T0, "0x01"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(3)).publishEvent(captor.capture());
        assertThat(captor.getAllValues()).hasExactlyElementsOfTypes(
                DailySummaryUpsertedEvent.class, AccountActivityUpsertedEvent.class,
                WatchedAccountStatsUpsertedEvent.class);
    }

    @Test
    void apply_anyOrder_sameFinalState() {
        List<Trade> trades = List.of(
                buy(ACCOUNT_1, "2", "6000", T0, "0x01"),
                sell(ACCOUNT_1, "1", "3100", T0.plusSeconds(3600), "0x02"),
                buy(ACCOUNT_1, "0.25", "700", T0.minusSeconds(3600), "0x03"),
                sell(ACCOUNT_1, "0.75", "2400", T0.plusSeconds(7200), "0x04"));
        List<Trade> shuffled = new ArrayList<>(trades);
        Collections.reverse(shuffled);

        AggregationStore other = new AggregationStore(new KeyedLockManager(5_000L, RetryPolicy.defaultPolicy()),
                new AppliedTradeLedger(Duration.ofHours(24), 10_000), eventPublisher);
        trades.forEach(store::apply);
        shuffled.forEach(other::apply);

        DailySummary a = store.getDailySummary(DAY, CHAIN).orElseThrow();
        DailySummary b = other.getDailySummary(DAY, CHAIN).orElseThrow();
        assertThat(a.getTotalTransactions()).isEqualTo(b.getTotalTransactions());
        assertThat(a.getTotalBuyQuote()).isEqualByComparingTo(b.getTotalBuyQuote());
        assertThat(a.getTotalSellBase()).isEqualByComparingTo(b.getTotalSellBase());
        assertThat(a.getMinPrice()).isEqualByComparingTo(b.getMinPrice());
        assertThat(a.getMaxPrice()).isEqualByComparingTo(b.getMaxPrice());
        assertThat(a.getLastUpdated()).isEqualTo(b.getLastUpdated());

        WatchedAccountStats sa = store.getWatchedAccountStats(ACCOUNT_1).orElseThrow();
        WatchedAccountStats sb = other.getWatchedAccountStats(ACCOUNT_1).orElseThrow();
        assertThat(sb.getFirstTradeAt()).isEqualTo(sa.getFirstTradeAt()).isEqualTo(T0.minusSeconds(3600));
        assertThat(sb.getLastTradeAt()).isEqualTo(sa.getLastTradeAt()).isEqualTo(T0.plusSeconds(7200));
    }

    @Test
    void apply_concurrentDistinctTrades_noLostUpdates() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    String account = i % 2 == 0 ? ACCOUNT_1 : ACCOUNT_2;
                    store.apply(buy(account, "1", "3000", T0.plusSeconds(i), "0x" + thread + "-" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        DailySummary daily = store.getDailySummary(DAY, CHAIN).orElseThrow();
        assertThat(daily.getTotalTransactions()).isEqualTo(threads * perThread);
        assertThat(daily.getTotalBuyBase()).isEqualByComparingTo(String.valueOf(threads * perThread));
        assertThat(store.getWatchedAccountStats(ACCOUNT_1).orElseThrow().getTotalTrades()
                + store.getWatchedAccountStats(ACCOUNT_2).orElseThrow().getTotalTrades())
                .isEqualTo(threads * perThread);
    }

    @Test
    @DisplayName("lock timeout on one key commits nothing for any key")
    void apply_lockTimeout_allOrNothing() throws Exception {
        KeyedLockManager impatientLocks = new KeyedLockManager(10L, new RetryPolicy(1L, 0, 2));
        AggregationStore impatient = new AggregationStore(impatientLocks,
                new AppliedTradeLedger(Duration.ofHours(24), 10_000), eventPublisher);
        Trade trade = buy(ACCOUNT_1, "2", "6000", T0, "0x01");

        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService holder = Executors.newSingleThreadExecutor();
        Future<?> holding = holder.submit(() -> {
            try (KeyedLockManager.LockHandle ignored = impatientLocks.acquireAll(List.of(AccountStatsKey.of(trade)))) {
                held.countDown();
                release.await();
            }
            return null;
        });
        held.await(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> impatient.apply(trade))
                .isInstanceOfSatisfying(AggregateLockTimeoutException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(AggregateLockTimeoutException.LOCK_TIMEOUT);
                    assertThat(ex.getAggregateKey()).isEqualTo(AccountStatsKey.of(trade));
                });
        assertThat(impatient.getDailySummary(DAY, CHAIN)).isEmpty();
        assertThat(impatient.getAccountActivity(ACCOUNT_1, DAY)).isEmpty();
        assertThat(impatient.getWatchedAccountStats(ACCOUNT_1)).isEmpty();

        release.countDown();
        holding.get(5, TimeUnit.SECONDS);
        holder.shutdown();

        AggregationResult retried = impatient.apply(trade);
        assertThat(retried.dailySummaryApplied()).isTrue();
        assertThat(impatient.getDailySummary(DAY, CHAIN).orElseThrow().getTotalTransactions()).isEqualTo(1);
    }

    @Test
    @DisplayName("upserts for one key reach listeners in commit order under contention")
    void apply_concurrentSameKey_upsertsInCommitOrder() throws Exception {
        List<Long> dailyTotals = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch firstPublishing = new CountDownLatch(1);
        ApplicationEventPublisher slowFirstPublisher = event -> {
            if (event instanceof DailySummaryUpsertedEvent upsert) {
                if (upsert.summary().getTotalTransactions() == 1) {
                    firstPublishing.countDown();
                    try {
                        Thread.sleep(200);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                dailyTotals.add(upsert.summary().getTotalTransactions());
            }
        };
        AggregationStore ordered = new AggregationStore(new KeyedLockManager(5_000L, new RetryPolicy(1L, 0, 3)),
                new AppliedTradeLedger(Duration.ofHours(24), 10_000), slowFirstPublisher);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        Future<?> first = pool.submit(() -> ordered.apply(buy(ACCOUNT_1, "1", "3000", T0, "0x01")));
        assertThat(firstPublishing.await(5, TimeUnit.SECONDS)).isTrue();
        Future<?> second = pool.submit(() -> ordered.apply(buy(ACCOUNT_2, "1", "3000", T0, "0x02")));
        first.get(10, TimeUnit.SECONDS);
        second.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        long stored = ordered.getDailySummary(DAY, CHAIN).orElseThrow().getTotalTransactions();
        assertThat(stored).isEqualTo(2);
        assertThat(dailyTotals).containsExactly(1L, 2L);
        assertThat(dailyTotals.get(dailyTotals.size() - 1)).isEqualTo(stored);
    }

    @Test
    void readAccessors_returnDetachedCopies() {
        store.apply(buy(ACCOUNT_1, "2", "6000", T0, "0x01"));

        DailySummary copy = store.getDailySummary(DAY, CHAIN).orElseThrow();
        copy.setTotalTransactions(99);

        assertThat(store.getDailySummary(DAY, CHAIN).orElseThrow().getTotalTransactions()).isEqualTo(1);
    }

    @Test
    void reset_clearsAggregatesAndAppliedMarks() {
        Trade trade = buy(ACCOUNT_1, "2", "6000", T0, "0x01");
        store.apply(trade);

        store.reset();

        assertThat(store.getDailySummary(DAY, CHAIN)).isEmpty();
        assertThat(store.apply(trade).dailySummaryApplied()).isTrue();
        verify(eventPublisher, atLeastOnce()).publishEvent(any(Object.class));
    }
}
