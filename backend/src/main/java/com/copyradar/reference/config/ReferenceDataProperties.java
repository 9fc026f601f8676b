package com.copyradar.reference.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Static reference data: watched accounts and monitored pools. Loaded once at startup; see application.yml
 * copyradar.reference.
 */
@ConfigurationProperties(prefix = "copyradar.reference")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ReferenceDataProperties {

    @Valid
    private List<WatchedAccountEntry> watchedAccounts = new ArrayList<>();

    @Valid
    private List<PoolEntry> pools = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class WatchedAccountEntry {
        @NotBlank
        private String address;
        /** Display name, e.g. "HFT_Trader_1". Defaults to the address. */
        private String name;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class PoolEntry {
        @NotBlank
        private String address;
        /** e.g. "ETH-USDC-0.05". */
        private String label;
        /** e.g. "0.05%". */
        private String fee;
        /** e.g. 500 for 0.05%. */
        private int feeTier;
        /** True when token A (token0) is the base asset. */
        private boolean baseIsTokenA;
        @Min(0)
        private int baseDecimals = 18;
        @Min(0)
        private int quoteDecimals = 6;
    }
}
