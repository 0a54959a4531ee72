package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.sampling")
public class SamplingConfig {
    private int defaultTargetSize = 100;
    private Long seed;                  // fixed seed for every sample when set
    private double minCoverage = 0.70;
}
