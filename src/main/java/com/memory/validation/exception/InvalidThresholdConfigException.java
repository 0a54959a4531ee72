package com.memory.validation.exception;

/**
 * Thrown when a threshold configuration breaks its ordering or weight invariants.
 * Such a configuration is never clamped into shape: it is refused outright.
 */
public class InvalidThresholdConfigException extends RuntimeException {

    public InvalidThresholdConfigException(String message) {
        super(message);
    }
}
