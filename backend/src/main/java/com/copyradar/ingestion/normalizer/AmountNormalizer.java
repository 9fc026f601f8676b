package com.copyradar.ingestion.normalizer;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts raw fixed-point token amounts to decimal quantities: raw / 10^decimals.
 * Integer quotient and remainder are scaled separately, so the result is exact (no floating point).
 */
@Component
public class AmountNormalizer {

    /**
     * @param rawDelta      signed raw amount (e.g. wei)
     * @param decimalPlaces token decimals (18 for WETH, 6 for USDC)
     * @return exact decimal with the same sign as rawDelta
     */
    public BigDecimal normalize(BigInteger rawDelta, int decimalPlaces) {
        if (decimalPlaces < 0) {
            throw new IllegalArgumentException("decimalPlaces must be non-negative, got: " + decimalPlaces);
        }
        if (rawDelta == null || rawDelta.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigInteger[] quotientAndRemainder = rawDelta.divideAndRemainder(BigInteger.TEN.pow(decimalPlaces));
        BigDecimal whole = new BigDecimal(quotientAndRemainder[0]);
        BigDecimal fraction = new BigDecimal(quotientAndRemainder[1], decimalPlaces);
        return whole.add(fraction);
    }

    /** Magnitude of {@link #normalize(BigInteger, int)}. */
    public BigDecimal normalizeAbs(BigInteger rawDelta, int decimalPlaces) {
        return normalize(rawDelta, decimalPlaces).abs();
    }
}
