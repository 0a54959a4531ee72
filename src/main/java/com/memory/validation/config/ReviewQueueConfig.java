package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.review-queue")
public class ReviewQueueConfig {
    private int recencyWindowHours = 168;                // recency decays to 0 over 7 days
    private double urgentSignificance = 8.0;             // queued even when auto-decided
    private double significanceWeight = 0.7;
    private double recencyWeight = 0.3;
    private int defaultPageSize = 50;
}
