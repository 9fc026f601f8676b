package com.copyradar.similarity;

import com.copyradar.domain.SimilarityEvent;
import com.copyradar.domain.Trade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores suspect trades against reference trades falling within a time window:
 * <pre>
 *   score = w_direction * [same direction]
 *         + w_proximity * (1 - |offset| / window)
 *         + w_size      * (1 - |a - b| / max(a, b))
 * </pre>
 * Both sequences are sorted by timestamp and scanned with a sliding window, so the cost is linear in the
 * inputs plus the number of candidate pairs. Every qualifying pair is reported; overlapping windows are not merged.
 */
@Component
@RequiredArgsConstructor
public class SimilarityDetector {

    private static final Comparator<Trade> BY_TIME = Comparator.comparing(Trade::timestamp);

    private final SimilarityWeights weights;

    /**
     * @param timeWindowSeconds inclusive bound on |suspect - reference| time offset
     * @param threshold         minimum score to report (inclusive)
     * @throws IllegalArgumentException when the window is negative
     */
    public List<SimilarityEvent> detect(List<Trade> referenceTrades, List<Trade> suspectTrades,
                                        long timeWindowSeconds, double threshold) {
        if (timeWindowSeconds < 0) {
            throw new IllegalArgumentException("timeWindowSeconds must not be negative: " + timeWindowSeconds);
        }
        if (referenceTrades.isEmpty() || suspectTrades.isEmpty()) {
            return List.of();
        }
        List<Trade> reference = sortedByTime(referenceTrades);
        List<Trade> suspect = sortedByTime(suspectTrades);
        Duration window = Duration.ofSeconds(timeWindowSeconds);

        List<SimilarityEvent> events = new ArrayList<>();
        int start = 0;
        for (Trade ref : reference) {
            // References ascend, so suspects before this window start are out of every later window too.
            while (start < suspect.size()
                    && suspect.get(start).timestamp().isBefore(ref.timestamp().minus(window))) {
                start++;
            }
            for (int j = start; j < suspect.size(); j++) {
                Trade candidate = suspect.get(j);
                if (candidate.timestamp().isAfter(ref.timestamp().plus(window))) {
                    break;
                }
                Duration offset = Duration.between(ref.timestamp(), candidate.timestamp());
                boolean directionMatch = ref.direction() == candidate.direction();
                double score = weights.direction() * (directionMatch ? 1.0 : 0.0)
                        + weights.proximity() * proximity(offset, window)
                        + weights.size() * sizeSimilarity(ref.baseAmount(), candidate.baseAmount());
                if (score >= threshold) {
                    events.add(new SimilarityEvent(
                            ref.accountAddress(),
                            candidate.accountAddress(),
                            ref.id(),
                            candidate.id(),
                            offset.getSeconds(),
                            directionMatch,
                            score,
                            ref.direction(),
                            candidate.direction(),
                            ref.baseAmount(),
                            candidate.baseAmount()));
                }
            }
        }
        return events;
    }

    /** 1 at zero offset falling linearly to 0 at the window edge; a zero window only admits exact matches. */
    static double proximity(Duration offset, Duration window) {
        if (window.isZero()) {
            return 1.0;
        }
        double ratio = (double) offset.abs().toMillis() / window.toMillis();
        return Math.max(0.0, 1.0 - ratio);
    }

    /** 1 - |a - b| / max(a, b); 1 when both are zero. */
    static double sizeSimilarity(BigDecimal a, BigDecimal b) {
        BigDecimal max = a.max(b);
        if (max.signum() == 0) {
            return 1.0;
        }
        BigDecimal relativeDiff = a.subtract(b).abs().divide(max, MathContext.DECIMAL64);
        return BigDecimal.ONE.subtract(relativeDiff).doubleValue();
    }

    private static List<Trade> sortedByTime(List<Trade> trades) {
        List<Trade> sorted = new ArrayList<>(trades);
        sorted.sort(BY_TIME);
        return sorted;
    }
}
