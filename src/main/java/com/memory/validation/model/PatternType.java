package com.memory.validation.model;

public enum PatternType {
    SUPPORT_SEEKING(0.9),
    MOOD_REPAIR(0.7),
    CELEBRATION(0.5),
    VULNERABILITY(1.0),
    GROWTH(0.7);

    // How strongly a detected pattern of this type counts as a psychological marker
    private final double markerWeight;

    PatternType(double markerWeight) {
        this.markerWeight = markerWeight;
    }

    public double getMarkerWeight() {
        return markerWeight;
    }

    public boolean signalsTurningPoint() {
        return this == GROWTH || this == MOOD_REPAIR;
    }
}
