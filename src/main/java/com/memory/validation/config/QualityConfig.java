package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.quality")
public class QualityConfig {
    private int refreshIntervalMinutes = 5;
    private int windowSize = 1000;
    private int minSamplesForAlerts = 20;
    private double minAutoApproveAccuracy = 0.90;
    private double maxFalsePositiveRate = 0.05;
    private double maxFalseNegativeRate = 0.05;
}
