package com.copyradar.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * Pool swap as delivered by the event source, ordered by (blockNumber, logIndex) per pool contract.
 * Deltas are raw fixed-point integers from the pool's perspective: positive = paid out to the recipient,
 * negative = paid in by the sender. Identity is (transactionHash, logIndex).
 */
public record SwapEvent(
        String transactionHash,
        long logIndex,
        long blockNumber,
        Instant blockTimestamp,
        String sender,
        String recipient,
        BigInteger amountA,
        BigInteger amountB,
        String poolId
) {

    public SwapEvent {
        Objects.requireNonNull(transactionHash, "transactionHash must not be null");
        Objects.requireNonNull(blockTimestamp, "blockTimestamp must not be null");
        Objects.requireNonNull(amountA, "amountA must not be null");
        Objects.requireNonNull(amountB, "amountB must not be null");
    }
}
