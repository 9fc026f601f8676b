package com.copyradar.similarity;

import com.copyradar.similarity.config.SimilarityProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic similarity sweep over the configured reference accounts. Disabled unless
 * {@code copyradar.similarity.scan.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SimilarityScanJob {

    private final SimilarityScanService similarityScanService;
    private final SimilarityProperties properties;

    @Scheduled(fixedDelayString = "${copyradar.similarity.scan.interval-ms:300000}")
    public void runScheduled() {
        SimilarityProperties.Scan scan = properties.getScan();
        if (!scan.isEnabled() || scan.getReferenceAccounts().isEmpty()) {
            return;
        }
        for (String reference : scan.getReferenceAccounts()) {
            try {
                SimilaritySweepResult result = similarityScanService.sweep(reference,
                        properties.getTimeWindowSeconds(), properties.getThreshold());
                long flagged = result.reports().values().stream().filter(r -> r.pairCount() > 0).count();
                log.info("Similarity sweep for {}: {} of {} accounts with matching pairs",
                        reference, flagged, result.reports().size());
                if (result.cancelled()) {
                    return;
                }
            } catch (IllegalArgumentException e) {
                log.warn("Similarity sweep for {} skipped: {}", reference, e.getMessage());
            }
        }
    }
}
