package com.memory.validation.model;

public enum TemporalDistribution {
    EVEN,
    CLUSTERED,
    SPARSE
}
