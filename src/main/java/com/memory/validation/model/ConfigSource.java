package com.memory.validation.model;

public enum ConfigSource {
    STARTUP,
    OPERATOR,
    CALIBRATION
}
