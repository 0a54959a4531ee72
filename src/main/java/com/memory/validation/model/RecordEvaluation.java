package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;

/**
 * Full trace of a single-record evaluation: what was scored, which thresholds applied, and the verdict.
 */
@Value
@Builder
public class RecordEvaluation {
    ConfidenceResult confidence;
    SignificanceScore significance;
    ThresholdConfig effectiveThresholds;
    ValidationDecision decision;
}
