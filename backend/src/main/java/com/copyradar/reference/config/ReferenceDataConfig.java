package com.copyradar.reference.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReferenceDataProperties.class)
public class ReferenceDataConfig {
}
