package com.memory.validation.model;

/**
 * What the human reviewer actually decided for a record.
 */
public enum HumanDecision {
    APPROVED,
    REJECTED
}
