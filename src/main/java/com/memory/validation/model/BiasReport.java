package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BiasReport {
    boolean detected;
    BiasDirection direction;
    double meanPredictedConfidence;
    double humanApprovalRate;
    double bias;                 // meanPredictedConfidence - humanApprovalRate

    public static BiasReport none() {
        return BiasReport.builder().direction(BiasDirection.NONE).build();
    }
}
