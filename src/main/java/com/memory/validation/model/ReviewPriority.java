package com.memory.validation.model;

public enum ReviewPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
