package com.copyradar.similarity.config;

import com.copyradar.similarity.SimilarityWeights;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SimilarityProperties.class)
public class SimilarityConfig {

    /** Fails startup when configured weights do not sum to 1. */
    @Bean
    public SimilarityWeights similarityWeights(SimilarityProperties properties) {
        return new SimilarityWeights(properties.getDirectionWeight(), properties.getProximityWeight(),
                properties.getSizeWeight());
    }
}
