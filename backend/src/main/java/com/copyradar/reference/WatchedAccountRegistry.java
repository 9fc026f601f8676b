package com.copyradar.reference;

import com.copyradar.common.Addresses;
import com.copyradar.domain.WatchedAccount;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of watched accounts by lower-cased address. Never mutated after construction;
 * a reload builds a new instance.
 */
public final class WatchedAccountRegistry {

    private final Map<String, WatchedAccount> byAddress;

    public WatchedAccountRegistry(Collection<WatchedAccount> accounts) {
        Map<String, WatchedAccount> map = new LinkedHashMap<>();
        for (WatchedAccount account : accounts) {
            if (map.putIfAbsent(account.address(), account) != null) {
                throw new IllegalArgumentException("Duplicate watched account: " + account.address());
            }
        }
        this.byAddress = Collections.unmodifiableMap(map);
    }

    public Optional<WatchedAccount> find(String address) {
        String key = Addresses.normalize(address);
        return key == null ? Optional.empty() : Optional.ofNullable(byAddress.get(key));
    }

    public boolean isWatched(String address) {
        return find(address).isPresent();
    }

    /** All accounts in configuration order. */
    public Collection<WatchedAccount> all() {
        return byAddress.values();
    }

    public int size() {
        return byAddress.size();
    }
}
