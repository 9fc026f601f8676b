package com.copyradar.domain;

/**
 * Application event: a new trade was classified and recorded. Not published for redelivered trades.
 */
public record TradeRecordedEvent(Trade trade) {
}
