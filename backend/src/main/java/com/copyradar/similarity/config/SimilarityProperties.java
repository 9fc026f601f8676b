package com.copyradar.similarity.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Similarity scoring weights (must sum to 1), default scan parameters and the optional periodic scan.
 */
@ConfigurationProperties(prefix = "copyradar.similarity")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SimilarityProperties {

    @DecimalMin("0.0")
    private double directionWeight = 0.5;

    @DecimalMin("0.0")
    private double proximityWeight = 0.3;

    @DecimalMin("0.0")
    private double sizeWeight = 0.2;

    /** Minimum score for a pair to be reported (inclusive). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double threshold = 0.7;

    /** Max |suspect - reference| time offset for a candidate pair (inclusive). */
    @Min(0)
    private long timeWindowSeconds = 300;

    @Valid
    private Scan scan = new Scan();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Scan {

        /** Periodic sweep of the reference accounts below. Off by default. */
        private boolean enabled = false;

        @Min(1000)
        private long intervalMs = 300_000L;

        /** Accounts each periodic sweep compares against all other watched accounts. */
        private List<String> referenceAccounts = new ArrayList<>();
    }
}
