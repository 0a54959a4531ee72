package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
@Builder
@Schema(description = "Rolling-window accuracy of engine verdicts against human feedback")
public class QualityMetrics {

    @Schema(description = "Feedback items in the window", example = "420")
    int sampleSize;

    @Schema(description = "Share of correct verdicts, review-required counted as correct", example = "0.94")
    double accuracy;

    @Schema(description = "Auto-approve verdicts in the window", example = "130")
    int autoApproveSamples;

    @Schema(description = "Share of auto-approvals the human confirmed", example = "0.96")
    double autoApproveAccuracy;

    @Schema(description = "Auto-reject verdicts in the window", example = "150")
    int autoRejectSamples;

    @Schema(description = "Share of auto-rejections the human confirmed", example = "0.93")
    double autoRejectAccuracy;

    @Schema(description = "Auto-approved but rejected by the human, over all samples", example = "0.012")
    double falsePositiveRate;

    @Schema(description = "Auto-rejected but approved by the human, over all samples", example = "0.02")
    double falseNegativeRate;

    @Schema(description = "Share of review effort avoided by correct automated verdicts", example = "0.61")
    double reviewTimeReduction;

    @Schema(description = "Accuracy change since the previous computation", example = "-0.01")
    double accuracyTrend;

    @Schema(description = "Accuracy by predicted-confidence band")
    List<ConfidenceBucket> confidenceBuckets;

    @Schema(description = "Computation timestamp, epoch milliseconds")
    long computedAt;

    public static QualityMetrics empty() {
        return QualityMetrics.builder()
                .confidenceBuckets(Collections.emptyList())
                .build();
    }
}
