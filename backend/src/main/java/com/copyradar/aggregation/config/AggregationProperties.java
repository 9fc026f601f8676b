package com.copyradar.aggregation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Aggregation store tuning: duplicate-detection window and per-key lock acquisition.
 */
@ConfigurationProperties(prefix = "copyradar.aggregation")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AggregationProperties {

    /** How long an applied trade id is remembered per aggregate key. Default 24h. */
    @NotNull
    private Duration appliedRetention = Duration.ofHours(24);

    /** Upper bound on remembered (aggregate key, trade id) marks. Default 1,000,000. */
    @Min(1)
    private long appliedMaxEntries = 1_000_000L;

    /** Wait per tryLock attempt on one aggregate key. Default 200ms. */
    @Min(0)
    private long lockTimeoutMs = 200L;

    @Valid
    private LockRetry lockRetry = new LockRetry();

    /** Trades kept per account in the trade history; 0 = unbounded. */
    @Min(0)
    private int maxTradesPerAccount = 0;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class LockRetry {

        /** Base delay between lock attempts; doubles each attempt. Default 10ms. */
        @Min(0)
        private long baseDelayMs = 10L;

        /** Jitter factor 0..1 (0.2 = ±20%). */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.2;

        /** Total tryLock attempts per key before giving up on the event. Default 3. */
        @Min(1)
        private int maxAttempts = 3;
    }
}
