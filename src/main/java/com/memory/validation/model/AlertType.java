package com.memory.validation.model;

public enum AlertType {
    LOW_AUTO_APPROVE_ACCURACY,
    HIGH_FALSE_POSITIVE_RATE,
    HIGH_FALSE_NEGATIVE_RATE
}
