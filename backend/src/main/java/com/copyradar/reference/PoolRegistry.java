package com.copyradar.reference;

import com.copyradar.common.Addresses;
import com.copyradar.domain.PoolMetadata;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable pool metadata by lower-cased pool address.
 */
public final class PoolRegistry {

    private final Map<String, PoolMetadata> byPoolId;

    public PoolRegistry(Collection<PoolMetadata> pools) {
        this.byPoolId = pools.stream()
                .collect(Collectors.toUnmodifiableMap(PoolMetadata::poolId, Function.identity(), (a, b) -> {
                    throw new IllegalArgumentException("Duplicate pool: " + a.poolId());
                }));
    }

    public Optional<PoolMetadata> find(String poolId) {
        String key = Addresses.normalize(poolId);
        return key == null ? Optional.empty() : Optional.ofNullable(byPoolId.get(key));
    }

    public int size() {
        return byPoolId.size();
    }
}
