package com.memory.validation.exception;

/**
 * Thrown when a memory record is missing data the scorer needs, or carries non-numeric signals.
 */
public class MalformedRecordException extends RuntimeException {

    private final String recordId;

    public MalformedRecordException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
