package com.memory.validation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.EnumMap;
import java.util.Map;

/**
 * The four confidence signals of one record, already clipped to [0, 1].
 */
@Value
@Builder
@Jacksonized
public class ConfidenceFactors {
    double extractionConfidence;
    double emotionalCoherence;
    double relationshipAccuracy;
    double contextQuality;

    public double get(ConfidenceFactor factor) {
        switch (factor) {
            case EXTRACTION_CONFIDENCE: return extractionConfidence;
            case EMOTIONAL_COHERENCE: return emotionalCoherence;
            case RELATIONSHIP_ACCURACY: return relationshipAccuracy;
            case CONTEXT_QUALITY: return contextQuality;
            default: throw new IllegalArgumentException("Unknown factor: " + factor);
        }
    }

    public Map<ConfidenceFactor, Double> asMap() {
        Map<ConfidenceFactor, Double> values = new EnumMap<>(ConfidenceFactor.class);
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            values.put(factor, get(factor));
        }
        return values;
    }
}
