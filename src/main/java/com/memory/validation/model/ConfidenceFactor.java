package com.memory.validation.model;

/**
 * The four independent per-record signals combined into one confidence.
 */
public enum ConfidenceFactor {
    EXTRACTION_CONFIDENCE("extractionConfidence"),
    EMOTIONAL_COHERENCE("emotionalCoherence"),
    RELATIONSHIP_ACCURACY("relationshipAccuracy"),
    CONTEXT_QUALITY("contextQuality");

    private final String fieldName;

    ConfidenceFactor(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
