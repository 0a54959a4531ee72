package com.memory.validation.model;

public enum ReviewBucket {
    CRITICAL,
    HIGH,
    STANDARD
}
