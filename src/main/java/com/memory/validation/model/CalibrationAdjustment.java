package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Schema(description = "Threshold and weight adjustment proposed from human feedback")
public class CalibrationAdjustment {

    @Schema(description = "What happened to the proposal", example = "APPLIED")
    CalibrationStatus status;

    ThresholdConfig previous;

    ThresholdConfig proposed;

    double autoApproveDelta;

    double reviewRequiredDelta;

    double autoRejectDelta;

    @Schema(description = "Human-readable reasons for each change or refusal")
    List<String> reasons;

    @Schema(description = "Estimated accuracy improvement (0-0.1)", example = "0.004")
    double improvementPotential;

    BiasReport bias;

    @Schema(description = "Feedback items the proposal is based on", example = "250")
    int sampleSize;

    @Schema(description = "Version published when the proposal was applied, otherwise null")
    Long appliedVersion;

    long evaluatedAt;

    public boolean hasChanges() {
        return autoApproveDelta != 0.0 || reviewRequiredDelta != 0.0 || autoRejectDelta != 0.0
                || (previous != null && proposed != null && !previous.getWeights().equals(proposed.getWeights()));
    }
}
