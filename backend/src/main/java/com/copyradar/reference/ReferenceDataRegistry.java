package com.copyradar.reference;

import com.copyradar.domain.PoolMetadata;
import com.copyradar.domain.WatchedAccount;
import com.copyradar.reference.config.ReferenceDataProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current watched-account set and pool metadata. Readers take {@link #current()} once per event
 * so a concurrent reload never mixes generations.
 */
@Component
@Slf4j
public class ReferenceDataRegistry {

    private final AtomicReference<ReferenceData> current = new AtomicReference<>();

    public ReferenceDataRegistry(ReferenceDataProperties properties) {
        replace(toAccounts(properties), toPools(properties));
    }

    public ReferenceData current() {
        return current.get();
    }

    /**
     * Installs a new generation. Callers that hold derived state must reset it (see SwapIngestionService#reload).
     */
    public ReferenceData replace(Collection<WatchedAccount> accounts, Collection<PoolMetadata> pools) {
        ReferenceData data = new ReferenceData(new WatchedAccountRegistry(accounts), new PoolRegistry(pools));
        current.set(data);
        log.info("Reference data loaded: {} watched accounts, {} pools",
                data.watchedAccounts().size(), data.pools().size());
        return data;
    }

    private static List<WatchedAccount> toAccounts(ReferenceDataProperties properties) {
        return properties.getWatchedAccounts().stream()
                .map(e -> new WatchedAccount(e.getAddress(), e.getName()))
                .toList();
    }

    private static List<PoolMetadata> toPools(ReferenceDataProperties properties) {
        return properties.getPools().stream()
                .map(e -> new PoolMetadata(e.getAddress(), e.getLabel(), e.getFee(), e.getFeeTier(),
                        e.isBaseIsTokenA(), e.getBaseDecimals(), e.getQuoteDecimals()))
                .toList();
    }
}
