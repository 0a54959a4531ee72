package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Batch performance, accuracy and system health in one view")
public class AnalyticsReport {

    @Schema(description = "Report timestamp, epoch milliseconds")
    long generatedAt;

    @Schema(description = "Latest quality metrics from the feedback window")
    QualityMetrics accuracy;

    PerformanceSummary performance;

    @Schema(description = "Most recent batches, oldest first")
    List<BatchTrend> batchTrends;

    SystemHealth systemHealth;

    List<String> recommendations;

    @Value
    @Builder
    public static class PerformanceSummary {
        long totalRecordsProcessed;
        long totalProcessingMs;
        double averageProcessingMs;   // per record
        int batchesRecorded;
        long uptimeMs;
    }

    @Value
    @Builder
    public static class BatchTrend {
        String batchId;
        long recordedAt;
        int records;
        double throughputPerMinute;
        double averageConfidence;
        double autoApprovalRate;
        long durationMs;
        QualityDistribution qualityDistribution;
    }

    @Value
    @Builder
    public static class SystemHealth {
        HealthStatus status;
        double score;
        List<String> issues;
        long uptimeMs;
    }
}
