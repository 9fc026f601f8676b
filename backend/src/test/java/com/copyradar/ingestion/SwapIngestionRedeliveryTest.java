package com.copyradar.ingestion;

import com.copyradar.aggregation.AggregateKey.AccountStatsKey;
import com.copyradar.aggregation.AggregateLockTimeoutException;
import com.copyradar.aggregation.AggregationStore;
import com.copyradar.aggregation.AppliedTradeLedger;
import com.copyradar.aggregation.config.AggregationProperties;
import com.copyradar.aggregation.history.TradeHistoryStore;
import com.copyradar.aggregation.lock.KeyedLockManager;
import com.copyradar.common.RetryPolicy;
import com.copyradar.domain.PoolMetadata;
import com.copyradar.domain.SwapEvent;
import com.copyradar.domain.TradeRecordedEvent;
import com.copyradar.domain.WatchedAccount;
import com.copyradar.ingestion.classifier.DirectionClassifier;
import com.copyradar.ingestion.classifier.TradeExtractor;
import com.copyradar.ingestion.config.IngestionProperties;
import com.copyradar.ingestion.normalizer.AmountNormalizer;
import com.copyradar.reference.ReferenceDataRegistry;
import com.copyradar.reference.config.ReferenceDataProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.copyradar.domain.TradeFixtures.ACCOUNT_1;
import static com.copyradar.domain.TradeFixtures.CHAIN;
import static com.copyradar.domain.TradeFixtures.POOL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

/**
 * Ingestion wired to real stores: a swap that fails on a lock timeout and is redelivered ends up in the history,
 * the aggregates and the trade notifications exactly once.
 */
@ExtendWith(MockitoExtension.class)
class SwapIngestionRedeliveryTest {

    private static final Instant TS = Instant.parse("2025-01-15T10:00:00Z");
    private static final String ROUTER = "0xe592427a0aece92de3edee1f18e0157c05861564";
    private static final SwapEvent SWAP = new SwapEvent("0x01", 0, 19_000_000L, TS, ROUTER, ACCOUNT_1,
            new BigInteger("2000000000000000000"), new BigInteger("-6000000000"), POOL);

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private KeyedLockManager lockManager;
    private TradeHistoryStore tradeHistoryStore;
    private AggregationStore aggregationStore;
    private SwapIngestionService service;

    @BeforeEach
    void setUp() {
        ReferenceDataRegistry registry = new ReferenceDataRegistry(new ReferenceDataProperties());
        registry.replace(List.of(new WatchedAccount(ACCOUNT_1, "HFT_Trader_1")),
                List.of(new PoolMetadata(POOL, "ETH-USDC-0.3", "0.3%", 3000, true, 18, 6)));
        lockManager = new KeyedLockManager(10L, new RetryPolicy(1L, 0, 2));
        aggregationStore = new AggregationStore(lockManager,
                new AppliedTradeLedger(Duration.ofHours(24), 10_000), eventPublisher);
        tradeHistoryStore = new TradeHistoryStore(new AggregationProperties());
        TradeExtractor extractor = new TradeExtractor(new DirectionClassifier(), new AmountNormalizer(),
                new IngestionProperties());
        service = new SwapIngestionService(registry, extractor, tradeHistoryStore, aggregationStore, eventPublisher);
    }

    @Test
    @DisplayName("lock timeout then redelivery: one history entry, one aggregate count, one TradeRecordedEvent")
    void accept_timeoutThenRedelivery_tradeAnnouncedOnce() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService holder = Executors.newSingleThreadExecutor();
        Future<?> holding = holder.submit(() -> {
            try (KeyedLockManager.LockHandle ignored = lockManager.acquireAll(List.of(new AccountStatsKey(ACCOUNT_1)))) {
                held.countDown();
                release.await();
            }
            return null;
        });
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.accept(SWAP)).isInstanceOf(AggregateLockTimeoutException.class);
        assertThat(tradeHistoryStore.snapshot(ACCOUNT_1)).isEmpty();
        assertThat(aggregationStore.getDailySummary(LocalDate.of(2025, 1, 15), CHAIN)).isEmpty();

        release.countDown();
        holding.get(5, TimeUnit.SECONDS);
        holder.shutdown();

        service.accept(SWAP);
        service.accept(SWAP);

        assertThat(tradeHistoryStore.snapshot(ACCOUNT_1)).hasSize(1);
        assertThat(aggregationStore.getDailySummary(LocalDate.of(2025, 1, 15), CHAIN).orElseThrow()
                .getTotalTransactions()).isEqualTo(1);
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        assertThat(captor.getAllValues()).filteredOn(TradeRecordedEvent.class::isInstance).hasSize(1);
    }
}
