package com.copyradar.domain;

import com.copyradar.common.Addresses;

import java.math.BigInteger;

/**
 * Static pool description. {@code baseIsTokenA} resolves which raw delta is the base asset
 * (e.g. WETH in a WETH/USDC pool), so direction rules do not depend on token0/token1 ordering.
 */
public record PoolMetadata(
        String poolId,
        String label,
        String feeLabel,
        int feeTier,
        boolean baseIsTokenA,
        int baseDecimals,
        int quoteDecimals
) {

    public PoolMetadata {
        poolId = Addresses.normalize(poolId);
        if (poolId == null) {
            throw new IllegalArgumentException("Pool id must not be blank");
        }
        if (baseDecimals < 0 || quoteDecimals < 0) {
            throw new IllegalArgumentException("Token decimals must be non-negative for pool " + poolId);
        }
    }

    public BigInteger baseDelta(SwapEvent swap) {
        return baseIsTokenA ? swap.amountA() : swap.amountB();
    }

    public BigInteger quoteDelta(SwapEvent swap) {
        return baseIsTokenA ? swap.amountB() : swap.amountA();
    }

    public int tokenADecimals() {
        return baseIsTokenA ? baseDecimals : quoteDecimals;
    }

    public int tokenBDecimals() {
        return baseIsTokenA ? quoteDecimals : baseDecimals;
    }
}
