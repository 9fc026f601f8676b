package com.copyradar.aggregation.query;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Buy/sell totals and average prices of one account over a time range.
 */
public record TradePerformanceSummary(
        String accountAddress,
        Instant from,
        Instant to,
        long tradeCount,
        long buyCount,
        long sellCount,
        BigDecimal totalBuyBase,
        BigDecimal totalSellBase,
        BigDecimal totalBuyQuote,
        BigDecimal totalSellQuote,
        BigDecimal avgBuyPrice,
        BigDecimal avgSellPrice
) {

    /** Base bought minus base sold over the range. */
    public BigDecimal netBasePosition() {
        return totalBuyBase.subtract(totalSellBase);
    }
}
