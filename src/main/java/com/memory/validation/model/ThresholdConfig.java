package com.memory.validation.model;

import com.memory.validation.exception.InvalidThresholdConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Decision cut points plus factor weights.
 *
 * Immutable: every change produces a new instance, and construction rejects any instance
 * that breaks {@code 0 <= autoReject <= reviewRequired <= autoApprove <= 1}.
 */
@Value
public class ThresholdConfig {

    double autoApprove;
    double reviewRequired;
    double autoReject;
    FactorWeights weights;

    @Builder(toBuilder = true)
    public ThresholdConfig(double autoApprove, double reviewRequired, double autoReject, FactorWeights weights) {
        checkCutPoint("autoApprove", autoApprove);
        checkCutPoint("reviewRequired", reviewRequired);
        checkCutPoint("autoReject", autoReject);
        if (autoReject > reviewRequired) {
            throw new InvalidThresholdConfigException(String.format(
                    "autoReject (%.4f) must not exceed reviewRequired (%.4f)", autoReject, reviewRequired));
        }
        if (reviewRequired > autoApprove) {
            throw new InvalidThresholdConfigException(String.format(
                    "reviewRequired (%.4f) must not exceed autoApprove (%.4f)", reviewRequired, autoApprove));
        }
        if (weights == null) {
            throw new InvalidThresholdConfigException("Factor weights are required");
        }
        this.autoApprove = autoApprove;
        this.reviewRequired = reviewRequired;
        this.autoReject = autoReject;
        this.weights = weights;
    }

    public static ThresholdConfig defaults() {
        return new ThresholdConfig(0.75, 0.50, 0.50, FactorWeights.defaults());
    }

    private static void checkCutPoint(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidThresholdConfigException(name + " must be within [0, 1], got " + value);
        }
    }
}
