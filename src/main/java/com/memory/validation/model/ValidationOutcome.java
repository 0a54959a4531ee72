package com.memory.validation.model;

/**
 * The three mutually exclusive verdicts the decision engine emits.
 */
public enum ValidationOutcome {
    AUTO_APPROVE,
    REVIEW_REQUIRED,
    AUTO_REJECT;

    public boolean isAutomated() {
        return this != REVIEW_REQUIRED;
    }
}
