package com.copyradar.aggregation.query;

import com.copyradar.aggregation.history.TradeHistoryStore;
import com.copyradar.domain.Trade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Read-side performance figures computed from the trade history.
 */
@Service
@RequiredArgsConstructor
public class TradePerformanceService {

    private static final int SCALE = 18;

    private final TradeHistoryStore tradeHistoryStore;

    public TradePerformanceSummary summarize(String accountAddress, Instant from, Instant to) {
        List<Trade> trades = tradeHistoryStore.snapshot(accountAddress, from, to);
        long buyCount = 0;
        long sellCount = 0;
        BigDecimal buyBase = BigDecimal.ZERO;
        BigDecimal sellBase = BigDecimal.ZERO;
        BigDecimal buyQuote = BigDecimal.ZERO;
        BigDecimal sellQuote = BigDecimal.ZERO;
        for (Trade trade : trades) {
            if (trade.isBuy()) {
                buyCount++;
                buyBase = buyBase.add(trade.baseAmount());
                buyQuote = buyQuote.add(trade.quoteAmount());
            } else {
                sellCount++;
                sellBase = sellBase.add(trade.baseAmount());
                sellQuote = sellQuote.add(trade.quoteAmount());
            }
        }
        return new TradePerformanceSummary(accountAddress, from, to, trades.size(), buyCount, sellCount,
                buyBase, sellBase, buyQuote, sellQuote,
                average(buyQuote, buyBase), average(sellQuote, sellBase));
    }

    private static BigDecimal average(BigDecimal quote, BigDecimal base) {
        if (base.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return quote.divide(base, SCALE, RoundingMode.HALF_UP);
    }
}
