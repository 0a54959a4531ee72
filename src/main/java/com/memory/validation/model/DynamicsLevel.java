package com.memory.validation.model;

public enum DynamicsLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH
}
