package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A human reviewer's verdict on a record the engine already decided. Append-only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Human verdict reported back by the review UI")
public class ValidationFeedback {

    @Schema(description = "Record identifier", example = "MEM-000042")
    String recordId;

    @Schema(description = "Verdict the engine predicted", example = "AUTO_APPROVE")
    ValidationOutcome predictedDecision;

    @Schema(description = "Verdict the human reached", example = "APPROVED")
    HumanDecision actualDecision;

    @Schema(description = "Reviewer's self-reported confidence (0-1)", example = "0.9")
    double reviewerConfidence;

    @Schema(description = "Why the reviewer disagreed, if they did")
    String disagreementReason;

    @Schema(description = "Seconds the reviewer spent", example = "45")
    int timeTakenSeconds;

    @Schema(description = "Quality rating of the extraction (1-5)", example = "4")
    int qualityRating;

    @Schema(description = "Confidence the engine predicted with (0-1)", example = "0.82")
    double predictedConfidence;

    @Schema(description = "Factor breakdown of the prediction, when the UI echoes it back")
    ConfidenceFactors factors;

    @Schema(description = "When the feedback was submitted, epoch milliseconds")
    long submittedAt;

    /**
     * Review-required predictions defer to the human and always count as correct.
     */
    public boolean isCorrect() {
        if (predictedDecision == ValidationOutcome.AUTO_APPROVE) {
            return actualDecision == HumanDecision.APPROVED;
        }
        if (predictedDecision == ValidationOutcome.AUTO_REJECT) {
            return actualDecision == HumanDecision.REJECTED;
        }
        return true;
    }

    public boolean isFalsePositive() {
        return predictedDecision == ValidationOutcome.AUTO_APPROVE && actualDecision == HumanDecision.REJECTED;
    }

    public boolean isFalseNegative() {
        return predictedDecision == ValidationOutcome.AUTO_REJECT && actualDecision == HumanDecision.APPROVED;
    }
}
