package com.copyradar.domain;

import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Running counters shared by the daily and per-account rollups. All sums are BigDecimal; average prices
 * are derived from the cumulative sums on read and never stored.
 */
@Getter
@Setter
public abstract class TradeVolumeTally {

    static final int PRICE_SCALE = 18;

    private long totalTransactions;
    private long buyCount;
    private long sellCount;
    private BigDecimal totalBuyBase = BigDecimal.ZERO;
    private BigDecimal totalSellBase = BigDecimal.ZERO;
    private BigDecimal totalBuyQuote = BigDecimal.ZERO;
    private BigDecimal totalSellQuote = BigDecimal.ZERO;
    private BigDecimal minPrice;
    private BigDecimal maxPrice;
    private Instant lastUpdated;

    /**
     * Adds one trade. Min/max start at the first trade's price.
     */
    public void accumulate(Trade trade) {
        totalTransactions++;
        if (trade.isBuy()) {
            buyCount++;
            totalBuyBase = totalBuyBase.add(trade.baseAmount());
            totalBuyQuote = totalBuyQuote.add(trade.quoteAmount());
        } else {
            sellCount++;
            totalSellBase = totalSellBase.add(trade.baseAmount());
            totalSellQuote = totalSellQuote.add(trade.quoteAmount());
        }
        BigDecimal price = trade.price();
        minPrice = minPrice == null ? price : minPrice.min(price);
        maxPrice = maxPrice == null ? price : maxPrice.max(price);
        if (lastUpdated == null || trade.timestamp().isAfter(lastUpdated)) {
            lastUpdated = trade.timestamp();
        }
    }

    public BigDecimal getTotalVolumeBase() {
        return totalBuyBase.add(totalSellBase);
    }

    public BigDecimal getTotalVolumeQuote() {
        return totalBuyQuote.add(totalSellQuote);
    }

    public BigDecimal getAvgBuyPrice() {
        return ratio(totalBuyQuote, totalBuyBase);
    }

    public BigDecimal getAvgSellPrice() {
        return ratio(totalSellQuote, totalSellBase);
    }

    protected void copyTallyInto(TradeVolumeTally target) {
        target.totalTransactions = totalTransactions;
        target.buyCount = buyCount;
        target.sellCount = sellCount;
        target.totalBuyBase = totalBuyBase;
        target.totalSellBase = totalSellBase;
        target.totalBuyQuote = totalBuyQuote;
        target.totalSellQuote = totalSellQuote;
        target.minPrice = minPrice;
        target.maxPrice = maxPrice;
        target.lastUpdated = lastUpdated;
    }

    static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
