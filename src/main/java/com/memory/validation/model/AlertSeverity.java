package com.memory.validation.model;

public enum AlertSeverity {
    HIGH,
    MEDIUM,
    LOW
}
