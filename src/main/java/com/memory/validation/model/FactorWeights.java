package com.memory.validation.model;

import com.memory.validation.exception.InvalidThresholdConfigException;
import lombok.Value;

import java.util.Map;

/**
 * Weights of the four confidence factors. Each weight is non-negative and together they sum to 1.
 */
@Value
public class FactorWeights {

    public static final double SUM_TOLERANCE = 1e-6;

    double extractionConfidence;
    double emotionalCoherence;
    double relationshipAccuracy;
    double contextQuality;

    public FactorWeights(double extractionConfidence, double emotionalCoherence,
                         double relationshipAccuracy, double contextQuality) {
        double[] all = {extractionConfidence, emotionalCoherence, relationshipAccuracy, contextQuality};
        double sum = 0.0;
        for (double w : all) {
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0.0) {
                throw new InvalidThresholdConfigException("Factor weights must be finite and >= 0, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidThresholdConfigException(
                    String.format("Factor weights must sum to 1, got %.6f", sum));
        }
        this.extractionConfidence = extractionConfidence;
        this.emotionalCoherence = emotionalCoherence;
        this.relationshipAccuracy = relationshipAccuracy;
        this.contextQuality = contextQuality;
    }

    public static FactorWeights defaults() {
        return new FactorWeights(0.40, 0.30, 0.20, 0.10);
    }

    /**
     * Build weights from raw (non-negative) values, scaling them so they sum to 1.
     */
    public static FactorWeights normalized(Map<ConfidenceFactor, Double> raw) {
        double total = 0.0;
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            total += raw.getOrDefault(factor, 0.0);
        }
        if (total <= 0.0) {
            throw new InvalidThresholdConfigException("Cannot normalize factor weights with a non-positive total");
        }
        return new FactorWeights(
                raw.getOrDefault(ConfidenceFactor.EXTRACTION_CONFIDENCE, 0.0) / total,
                raw.getOrDefault(ConfidenceFactor.EMOTIONAL_COHERENCE, 0.0) / total,
                raw.getOrDefault(ConfidenceFactor.RELATIONSHIP_ACCURACY, 0.0) / total,
                raw.getOrDefault(ConfidenceFactor.CONTEXT_QUALITY, 0.0) / total);
    }

    public double get(ConfidenceFactor factor) {
        switch (factor) {
            case EXTRACTION_CONFIDENCE: return extractionConfidence;
            case EMOTIONAL_COHERENCE: return emotionalCoherence;
            case RELATIONSHIP_ACCURACY: return relationshipAccuracy;
            case CONTEXT_QUALITY: return contextQuality;
            default: throw new IllegalArgumentException("Unknown factor: " + factor);
        }
    }
}
