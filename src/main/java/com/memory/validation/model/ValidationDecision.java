package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@Schema(description = "Verdict for a single memory record")
public class ValidationDecision {

    @Schema(description = "Record the decision applies to", example = "MEM-000042")
    String recordId;

    @Schema(description = "Verdict", example = "AUTO_APPROVE")
    ValidationOutcome outcome;

    @Schema(description = "Overall confidence that produced the verdict (0-1)", example = "0.845")
    double confidence;

    @Schema(description = "Factor breakdown behind the confidence")
    ConfidenceFactors factors;

    @Schema(description = "Why the engine decided this way")
    DecisionReasoning reasoning;

    @Schema(description = "Review priority", example = "MEDIUM")
    ReviewPriority priority;

    @Schema(description = "Estimated human review time in seconds (30-180)", example = "53")
    int estimatedReviewSeconds;

    @Schema(description = "Emotional significance (0-10)", example = "6.4")
    double significance;

    @Schema(description = "Distance from the confidence to the nearest cut point in effect", example = "0.095")
    double boundaryDistance;

    @Schema(description = "Timestamp of the underlying record, epoch milliseconds")
    long recordTimestamp;

    @Schema(description = "Threshold version the decision was made under", example = "3")
    long thresholdVersion;

    @Schema(description = "Decision timestamp, epoch milliseconds")
    long decidedAt;
}
