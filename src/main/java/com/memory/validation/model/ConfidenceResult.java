package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class ConfidenceResult {
    double overall;                              // clipped to [0, 1]
    ConfidenceFactors factors;
    List<ConfidenceFactor> uncertaintyAreas;     // weak factors hidden behind a passing overall score
    ValidationOutcome decision;                  // null until the decision engine has run

    public ConfidenceResult withDecision(ValidationOutcome outcome) {
        return toBuilder().decision(outcome).build();
    }
}
