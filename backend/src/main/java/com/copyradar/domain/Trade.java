package com.copyradar.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Classified trade of one watched account in one swap. Base and quote amounts are non-negative
 * magnitudes; amountA / amountB keep the signed pool deltas, normalized to decimals.
 */
public record Trade(
        TradeId id,
        Instant timestamp,
        long blockNumber,
        String chain,
        String protocol,
        String accountAddress,
        String accountName,
        PartyRole role,
        TradeDirection direction,
        BigDecimal baseAmount,
        BigDecimal quoteAmount,
        BigDecimal price,
        String poolId,
        String poolFee,
        String sender,
        String recipient,
        BigDecimal amountA,
        BigDecimal amountB
) {

    public String transactionHash() {
        return id.transactionHash();
    }

    public long logIndex() {
        return id.logIndex();
    }

    /** UTC calendar date of the block timestamp. */
    public LocalDate date() {
        return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
    }

    public boolean isBuy() {
        return direction == TradeDirection.BUY;
    }
}
