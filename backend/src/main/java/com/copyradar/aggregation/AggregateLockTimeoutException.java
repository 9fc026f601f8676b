package com.copyradar.aggregation;

import lombok.Getter;

/**
 * Thrown when the per-key lock of an aggregate could not be acquired within the retry budget.
 * Fatal for the single event being applied; nothing of that event has been committed.
 */
@Getter
public class AggregateLockTimeoutException extends RuntimeException {

    public static final String LOCK_TIMEOUT = "AGGREGATE_LOCK_TIMEOUT";
    public static final String LOCK_INTERRUPTED = "AGGREGATE_LOCK_INTERRUPTED";

    /** LOCK_TIMEOUT or LOCK_INTERRUPTED. */
    private final String errorCode;
    private final transient AggregateKey aggregateKey;

    public AggregateLockTimeoutException(String errorCode, AggregateKey aggregateKey, String message) {
        super(message);
        this.errorCode = errorCode;
        this.aggregateKey = aggregateKey;
    }

    public AggregateLockTimeoutException(String errorCode, AggregateKey aggregateKey, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.aggregateKey = aggregateKey;
    }
}
