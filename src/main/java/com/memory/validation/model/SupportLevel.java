package com.memory.validation.model;

public enum SupportLevel {
    HIGH,
    MEDIUM,
    LOW,
    NEGATIVE
}
