package com.copyradar.ingestion.classifier;

import com.copyradar.domain.TradeDirection;

import java.util.Optional;

/**
 * Result of direction inference. INDETERMINATE is a valid terminal outcome (zero-amount or malformed swap
 * from this account's point of view): no trade is emitted for it.
 */
public enum DirectionOutcome {
    BUY,
    SELL,
    INDETERMINATE;

    public Optional<TradeDirection> toTradeDirection() {
        return switch (this) {
            case BUY -> Optional.of(TradeDirection.BUY);
            case SELL -> Optional.of(TradeDirection.SELL);
            case INDETERMINATE -> Optional.empty();
        };
    }
}
