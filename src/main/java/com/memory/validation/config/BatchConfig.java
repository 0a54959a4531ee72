package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.batch")
public class BatchConfig {

    // Hard cap on concurrent evaluations for any single batch, and the shared pool size
    private int maxWorkers = 8;

    // Records per second one worker is expected to sustain
    private int perWorkerThroughput = 250;

    // Default throughput target when a request does not give one
    private int defaultTargetThroughput = 1000;

    private DistributionCheck distributionCheck = new DistributionCheck();

    @Data
    public static class DistributionCheck {
        private double expectedApproveRatio = 0.25;
        private double expectedReviewRatio = 0.25;
        private double expectedRejectRatio = 0.50;
        private double maxDeviation = 0.30;
        private int minSampleSize = 20;
        private double degenerateRatio = 0.95;
        private double maxErrorRate = 0.20;
    }
}
