package com.memory.validation.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of evaluating one record inside a batch: either a decision or an error, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EvaluationOutcome {
    int index;
    ValidationDecision decision;
    BatchError error;

    public static EvaluationOutcome success(int index, ValidationDecision decision) {
        return new EvaluationOutcome(index, decision, null);
    }

    public static EvaluationOutcome failure(int index, String recordId, String message) {
        return new EvaluationOutcome(index, null,
                BatchError.builder().index(index).recordId(recordId).message(message).build());
    }

    public boolean isSuccess() {
        return decision != null;
    }
}
