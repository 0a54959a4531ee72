package com.memory.validation.model;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
