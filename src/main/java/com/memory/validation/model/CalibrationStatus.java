package com.memory.validation.model;

public enum CalibrationStatus {
    APPLIED,        // proposal published as a new threshold version
    PROPOSED,       // dry run, nothing published
    NO_CHANGE,      // feedback supports the current thresholds
    DEFERRED,       // not enough samples, or quality already degrading
    REJECTED        // proposal invalid, or replaying the window under it made things worse
}
