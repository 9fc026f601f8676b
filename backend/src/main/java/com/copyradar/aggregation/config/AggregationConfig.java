package com.copyradar.aggregation.config;

import com.copyradar.aggregation.AppliedTradeLedger;
import com.copyradar.aggregation.lock.KeyedLockManager;
import com.copyradar.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the applied-trade ledger and per-key lock manager from {@link AggregationProperties}.
 */
@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
public class AggregationConfig {

    @Bean
    public AppliedTradeLedger appliedTradeLedger(AggregationProperties properties) {
        return new AppliedTradeLedger(properties.getAppliedRetention(), properties.getAppliedMaxEntries());
    }

    @Bean
    public KeyedLockManager keyedLockManager(AggregationProperties properties) {
        AggregationProperties.LockRetry retry = properties.getLockRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        return new KeyedLockManager(properties.getLockTimeoutMs(), retryPolicy);
    }
}
