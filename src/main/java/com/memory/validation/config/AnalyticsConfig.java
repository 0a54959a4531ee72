package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.analytics")
public class AnalyticsConfig {
    private int historySize = 100;
    private double targetThroughputPerMinute = 60.0;
}
