package com.copyradar.domain;

/**
 * Trade direction from the watched account's perspective. BUY = received the base asset.
 */
public enum TradeDirection {
    BUY,
    SELL
}
