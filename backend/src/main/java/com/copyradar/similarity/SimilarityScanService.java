package com.copyradar.similarity;

import com.copyradar.aggregation.history.TradeHistoryStore;
import com.copyradar.common.Addresses;
import com.copyradar.config.AsyncConfig;
import com.copyradar.domain.SimilarityDetectedEvent;
import com.copyradar.domain.SimilarityEvent;
import com.copyradar.domain.Trade;
import com.copyradar.domain.WatchedAccount;
import com.copyradar.reference.ReferenceDataRegistry;
import com.copyradar.similarity.config.SimilarityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * Runs similarity passes over trade-history snapshots. Holds no aggregation lock; a pass sees the history as of
 * the moment its snapshots were taken.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimilarityScanService {

    private final TradeHistoryStore tradeHistoryStore;
    private final SimilarityDetector similarityDetector;
    private final ReferenceDataRegistry referenceDataRegistry;
    private final SimilarityProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Compares two accounts. Publishes {@link SimilarityDetectedEvent} when any pair qualifies.
     *
     * @throws IllegalArgumentException when both addresses name the same account or the window is negative
     */
    public List<SimilarityEvent> runSimilarityScan(String referenceAccount, String suspectAccount,
                                                   long timeWindowSeconds, double threshold) {
        String reference = Addresses.normalize(referenceAccount);
        String suspect = Addresses.normalize(suspectAccount);
        if (reference == null || suspect == null) {
            throw new IllegalArgumentException("Reference and suspect accounts are required");
        }
        if (reference.equals(suspect)) {
            throw new IllegalArgumentException("Reference and suspect must differ: " + reference);
        }
        List<Trade> referenceTrades = tradeHistoryStore.snapshot(reference);
        List<Trade> suspectTrades = tradeHistoryStore.snapshot(suspect);
        List<SimilarityEvent> events = similarityDetector.detect(referenceTrades, suspectTrades,
                timeWindowSeconds, threshold);
        if (!events.isEmpty()) {
            log.info("Similarity {} -> {}: {} pairs over {} / {} trades (window {}s, threshold {})",
                    Addresses.abbreviate(reference), Addresses.abbreviate(suspect), events.size(),
                    referenceTrades.size(), suspectTrades.size(), timeWindowSeconds, threshold);
            eventPublisher.publishEvent(new SimilarityDetectedEvent(reference, suspect, events));
        }
        return events;
    }

    /** Same as above with the configured window and threshold. */
    public List<SimilarityEvent> runSimilarityScan(String referenceAccount, String suspectAccount) {
        return runSimilarityScan(referenceAccount, suspectAccount,
                properties.getTimeWindowSeconds(), properties.getThreshold());
    }

    public SimilarityReport summarize(String referenceAccount, String suspectAccount, List<SimilarityEvent> events) {
        return SimilarityReport.of(referenceAccount, suspectAccount, events);
    }

    /**
     * Compares the reference with every other watched account on the calling thread. Stops between account
     * pairs once the thread is interrupted; the interrupt flag is left set.
     */
    public SimilaritySweepResult sweep(String referenceAccount, long timeWindowSeconds, double threshold) {
        String reference = Addresses.normalize(referenceAccount);
        Map<String, SimilarityReport> reports = new LinkedHashMap<>();
        for (WatchedAccount account : referenceDataRegistry.current().watchedAccounts().all()) {
            if (account.address().equals(reference)) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.info("Similarity sweep for {} cancelled after {} accounts",
                        Addresses.abbreviate(reference), reports.size());
                return new SimilaritySweepResult(reference, reports, true);
            }
            List<SimilarityEvent> events = runSimilarityScan(reference, account.address(), timeWindowSeconds, threshold);
            reports.put(account.address(), summarize(reference, account.address(), events));
        }
        return new SimilaritySweepResult(reference, reports, false);
    }

    /**
     * Asynchronous {@link #sweep}. Cancelling the returned future with interruption stops it between account pairs.
     */
    @Async(AsyncConfig.SIMILARITY_EXECUTOR)
    public Future<SimilaritySweepResult> submitSweep(String referenceAccount, long timeWindowSeconds, double threshold) {
        return CompletableFuture.completedFuture(sweep(referenceAccount, timeWindowSeconds, threshold));
    }
}
