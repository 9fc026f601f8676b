package com.copyradar.ingestion;

import com.copyradar.aggregation.AggregationStore;
import com.copyradar.aggregation.history.TradeHistoryStore;
import com.copyradar.domain.PoolMetadata;
import com.copyradar.domain.SwapEvent;
import com.copyradar.domain.Trade;
import com.copyradar.domain.TradeRecordedEvent;
import com.copyradar.domain.WatchedAccount;
import com.copyradar.ingestion.classifier.TradeExtractor;
import com.copyradar.reference.ReferenceDataRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Entry point for swap events: classify against the current reference data, apply each trade to the aggregates,
 * record it in the history and announce it. Safe to call from many threads; events for different
 * aggregate keys proceed in parallel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SwapIngestionService {

    private final ReferenceDataRegistry referenceDataRegistry;
    private final TradeExtractor tradeExtractor;
    private final TradeHistoryStore tradeHistoryStore;
    private final AggregationStore aggregationStore;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return trades extracted from the swap (empty for unwatched parties, unknown pools or indeterminate direction)
     * @throws com.copyradar.aggregation.AggregateLockTimeoutException when aggregation of a trade cannot get its locks
     */
    public List<Trade> accept(SwapEvent swap) {
        List<Trade> trades = tradeExtractor.extract(swap, referenceDataRegistry.current());
        for (Trade trade : trades) {
            // History only after the aggregates took the trade, so a lock timeout leaves both untouched.
            aggregationStore.apply(trade);
            if (tradeHistoryStore.record(trade)) {
                log.info("Trade {} {} {} base @ {} by {} ({})", trade.id(), trade.direction(),
                        trade.baseAmount().toPlainString(), trade.price().toPlainString(),
                        trade.accountName(), trade.role());
                eventPublisher.publishEvent(new TradeRecordedEvent(trade));
            }
        }
        return trades;
    }

    /**
     * Replaces watched accounts and pools and drops all derived state. Not to be called while events are in flight.
     */
    public void reload(Collection<WatchedAccount> watchedAccounts, Collection<PoolMetadata> pools) {
        referenceDataRegistry.replace(watchedAccounts, pools);
        aggregationStore.reset();
        tradeHistoryStore.clear();
        log.info("Reference data reloaded; trade history and aggregates cleared");
    }
}
