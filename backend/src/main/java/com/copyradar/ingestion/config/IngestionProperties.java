package com.copyradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Labels stamped on every trade. Single chain per engine instance.
 */
@ConfigurationProperties(prefix = "copyradar.ingestion")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    /** Chain label, part of the daily summary key. */
    @NotBlank
    private String chain = "ethereum-mainnet";

    @NotBlank
    private String protocol = "uniswap_v3";
}
