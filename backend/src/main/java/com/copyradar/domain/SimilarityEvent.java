package com.copyradar.domain;

import java.math.BigDecimal;

/**
 * Candidate copy-trading evidence: a suspect trade close in time (and usually in direction and size)
 * to a reference trade. timeOffsetSeconds = suspect - reference, negative when the suspect traded first.
 */
public record SimilarityEvent(
        String referenceAccount,
        String suspectAccount,
        TradeId referenceTradeId,
        TradeId suspectTradeId,
        long timeOffsetSeconds,
        boolean directionMatch,
        double score,
        TradeDirection referenceDirection,
        TradeDirection suspectDirection,
        BigDecimal referenceBaseAmount,
        BigDecimal suspectBaseAmount
) {
}
