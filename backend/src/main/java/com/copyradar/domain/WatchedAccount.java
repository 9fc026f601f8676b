package com.copyradar.domain;

import com.copyradar.common.Addresses;

/**
 * Account whose trades are tracked. Address is lower-cased on construction.
 */
public record WatchedAccount(String address, String name) {

    public WatchedAccount {
        address = Addresses.normalize(address);
        if (address == null) {
            throw new IllegalArgumentException("Watched account address must not be blank");
        }
        if (name == null || name.isBlank()) {
            name = address;
        }
    }
}
