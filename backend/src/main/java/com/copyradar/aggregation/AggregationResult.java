package com.copyradar.aggregation;

import com.copyradar.domain.AccountActivity;
import com.copyradar.domain.DailySummary;
import com.copyradar.domain.WatchedAccountStats;

/**
 * Post-apply snapshots of the three aggregates a trade touches, plus whether the trade was newly applied
 * to each (false = identity already recorded for that key).
 */
public record AggregationResult(
        DailySummary dailySummary,
        AccountActivity accountActivity,
        WatchedAccountStats watchedAccountStats,
        boolean dailySummaryApplied,
        boolean accountActivityApplied,
        boolean watchedAccountStatsApplied
) {

    public boolean anyApplied() {
        return dailySummaryApplied || accountActivityApplied || watchedAccountStatsApplied;
    }
}
