package com.copyradar.domain;

import java.util.Objects;

/**
 * Trade identity. One swap log can yield a trade for the sender and one for the recipient,
 * so the account is part of the key alongside (transactionHash, logIndex).
 */
public record TradeId(String transactionHash, long logIndex, String accountAddress) {

    public TradeId {
        Objects.requireNonNull(transactionHash, "transactionHash must not be null");
        Objects.requireNonNull(accountAddress, "accountAddress must not be null");
    }

    /** Storage id, e.g. {@code 0xabc…-12-0x66a9…}. */
    public String value() {
        return transactionHash + "-" + logIndex + "-" + accountAddress;
    }

    @Override
    public String toString() {
        return value();
    }
}
