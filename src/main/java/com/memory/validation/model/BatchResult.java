package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Outcome of validating a batch of memory records")
public class BatchResult {

    @Schema(description = "Batch identifier")
    String batchId;

    @Schema(description = "Threshold version snapshotted at batch start", example = "3")
    long thresholdVersion;

    @Schema(description = "Records submitted", example = "1000")
    int totalRecords;

    @Schema(description = "Records evaluated successfully", example = "998")
    int processedCount;

    @Schema(description = "Records never dispatched because the batch was cancelled", example = "0")
    int skippedCount;

    @Schema(description = "Decision counts by verdict")
    Map<ValidationOutcome, Integer> decisionCounts;

    @Schema(description = "Average confidence over successful evaluations", example = "0.61")
    double averageConfidence;

    @Schema(description = "Wall-clock duration in milliseconds", example = "84")
    long durationMs;

    @Schema(description = "Worker slots used for this batch", example = "4")
    int workerCount;

    @Schema(description = "Per-record decisions")
    List<ValidationDecision> decisions;

    @Schema(description = "Records that could not be evaluated")
    List<BatchError> errors;

    @Schema(description = "Post-hoc sanity check of the verdict distribution")
    DistributionCheck distributionCheck;

    @Schema(description = "Quality metrics in effect when the batch finished")
    QualityMetrics qualitySnapshot;

    @Schema(description = "Whether dispatch was stopped early")
    boolean cancelled;
}
