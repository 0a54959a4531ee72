package com.memory.validation.config;

import com.memory.validation.model.FactorWeights;
import com.memory.validation.model.ThresholdConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Startup thresholds. Only read once to seed version 1 of the threshold store;
 * later changes go through calibration or the operator endpoints.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "validation.thresholds")
public class ValidationThresholdConfig {

    // Confidence strictly above this is auto-approved
    private double autoApprove = 0.75;

    // Lower edge of the review band
    private double reviewRequired = 0.50;

    // Confidence at or below this is auto-rejected
    private double autoReject = 0.50;

    private Weights weights = new Weights();

    @Data
    public static class Weights {
        private double extractionConfidence = 0.40;
        private double emotionalCoherence = 0.30;
        private double relationshipAccuracy = 0.20;
        private double contextQuality = 0.10;
    }

    public ThresholdConfig toThresholdConfig() {
        return new ThresholdConfig(autoApprove, reviewRequired, autoReject,
                new FactorWeights(weights.getExtractionConfidence(), weights.getEmotionalCoherence(),
                        weights.getRelationshipAccuracy(), weights.getContextQuality()));
    }
}
