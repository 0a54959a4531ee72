package com.memory.validation.model;

public enum TrajectoryDirection {
    IMPROVING(5.0),
    DECLINING(6.0),
    STABLE(2.0),
    VOLATILE(8.0);

    // Base turning-point potential on the 0-10 significance scale
    private final double turningPointBase;

    TrajectoryDirection(double turningPointBase) {
        this.turningPointBase = turningPointBase;
    }

    public double getTurningPointBase() {
        return turningPointBase;
    }
}
