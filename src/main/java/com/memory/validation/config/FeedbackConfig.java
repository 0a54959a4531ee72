package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.feedback")
public class FeedbackConfig {
    private int retention = 5000;                        // newest feedback items kept in memory
    private int maxReviewSeconds = 86400;
}
