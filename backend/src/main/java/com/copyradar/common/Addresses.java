package com.copyradar.common;

import java.util.Locale;

/**
 * EVM address helpers. Addresses are compared and stored lower-cased.
 */
public final class Addresses {

    private Addresses() {
    }

    /**
     * Lower-cased, stripped address; null or blank input yields null.
     */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.strip().toLowerCase(Locale.ROOT);
    }

    /** Short form for log lines, e.g. 0x66a9893c…7dab. */
    public static String abbreviate(String address) {
        if (address == null || address.length() <= 14) {
            return address;
        }
        return address.substring(0, 10) + "…" + address.substring(address.length() - 4);
    }
}
