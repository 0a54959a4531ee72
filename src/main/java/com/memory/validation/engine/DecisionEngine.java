package com.memory.validation.engine;

import com.memory.validation.model.ConfidenceFactor;
import com.memory.validation.model.ConfidenceFactors;
import com.memory.validation.model.ConfidenceResult;
import com.memory.validation.model.DecisionReasoning;
import com.memory.validation.model.FactorWeights;
import com.memory.validation.model.ReviewPriority;
import com.memory.validation.model.SignificanceScore;
import com.memory.validation.model.ThresholdConfig;
import com.memory.validation.model.ValidationDecision;
import com.memory.validation.model.ValidationOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a confidence onto one of three verdicts and annotates it with priority, review effort and reasoning.
 *
 * confidence &gt; autoApprove → AUTO_APPROVE, confidence ≤ autoReject → AUTO_REJECT, otherwise REVIEW_REQUIRED.
 * A tie at autoApprove therefore goes to review, and a tie at autoReject goes to rejection.
 * Holds no state; every input arrives as an argument.
 */
@Component
public class DecisionEngine {

    static final double BOUNDARY_PROXIMITY = 0.05;
    private static final double EPSILON = 1e-9;

    static final double CRITICAL_SIGNIFICANCE = 8.0;
    static final double HIGH_SIGNIFICANCE = 6.0;
    static final double MEDIUM_SIGNIFICANCE = 4.0;

    static final int MIN_REVIEW_SECONDS = 30;
    static final int MAX_REVIEW_SECONDS = 180;

    static final double STRENGTH_LIMIT = 0.8;

    public ValidationOutcome classify(double confidence, ThresholdConfig config) {
        if (confidence > config.getAutoApprove()) {
            return ValidationOutcome.AUTO_APPROVE;
        }
        if (confidence <= config.getAutoReject()) {
            return ValidationOutcome.AUTO_REJECT;
        }
        return ValidationOutcome.REVIEW_REQUIRED;
    }

    public ReviewPriority prioritize(double confidence, ValidationOutcome outcome,
                                     double significance, ThresholdConfig config) {
        if (significance >= CRITICAL_SIGNIFICANCE
                || boundaryDistance(confidence, config) <= BOUNDARY_PROXIMITY + EPSILON) {
            return ReviewPriority.CRITICAL;
        }
        if (significance >= HIGH_SIGNIFICANCE) {
            return ReviewPriority.HIGH;
        }
        if (significance >= MEDIUM_SIGNIFICANCE || outcome == ValidationOutcome.REVIEW_REQUIRED) {
            return ReviewPriority.MEDIUM;
        }
        return ReviewPriority.LOW;
    }

    /**
     * Expected human review effort: 180s at zero confidence down to 30s at full confidence.
     */
    public int estimateReviewSeconds(double confidence) {
        long seconds = Math.round(180.0 - 150.0 * confidence);
        return (int) Math.max(MIN_REVIEW_SECONDS, Math.min(MAX_REVIEW_SECONDS, seconds));
    }

    public double boundaryDistance(double confidence, ThresholdConfig config) {
        double distance = Math.abs(confidence - config.getAutoApprove());
        distance = Math.min(distance, Math.abs(confidence - config.getReviewRequired()));
        distance = Math.min(distance, Math.abs(confidence - config.getAutoReject()));
        return distance;
    }

    public ValidationDecision decide(String recordId, ConfidenceResult result,
                                     ThresholdConfig config, SignificanceScore significance) {
        return decide(recordId, result, config, significance, 0L, 0L);
    }

    public ValidationDecision decide(String recordId, ConfidenceResult result, ThresholdConfig config,
                                     SignificanceScore significance, long thresholdVersion, long recordTimestamp) {
        double confidence = result.getOverall();
        double sig = significance != null ? significance.getValue() : 0.0;
        ValidationOutcome outcome = classify(confidence, config);

        return ValidationDecision.builder()
                .recordId(recordId)
                .outcome(outcome)
                .confidence(confidence)
                .factors(result.getFactors())
                .reasoning(explain(outcome, result, config))
                .priority(prioritize(confidence, outcome, sig, config))
                .estimatedReviewSeconds(estimateReviewSeconds(confidence))
                .significance(sig)
                .boundaryDistance(Math.round(boundaryDistance(confidence, config) * 1000.0) / 1000.0)
                .recordTimestamp(recordTimestamp)
                .thresholdVersion(thresholdVersion)
                .decidedAt(System.currentTimeMillis())
                .build();
    }

    DecisionReasoning explain(ValidationOutcome outcome, ConfidenceResult result, ThresholdConfig config) {
        ConfidenceFactors factors = result.getFactors();
        FactorWeights weights = config.getWeights();

        ConfidenceFactor driver = null;
        double best = 0.0;
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            // Approvals are explained by their largest contribution, everything else by the weakest signal
            double score = outcome == ValidationOutcome.AUTO_APPROVE
                    ? weights.get(factor) * factors.get(factor)
                    : -factors.get(factor);
            if (driver == null || score > best) {
                driver = factor;
                best = score;
            }
        }

        List<ConfidenceFactor> strengths = new ArrayList<>();
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            if (factors.get(factor) >= STRENGTH_LIMIT) {
                strengths.add(factor);
            }
        }

        List<ConfidenceFactor> uncertain = result.getUncertaintyAreas() != null
                ? result.getUncertaintyAreas() : List.of();

        return DecisionReasoning.builder()
                .primaryDriver(driver)
                .uncertaintyAreas(uncertain)
                .strengths(List.copyOf(strengths))
                .summary(summarize(outcome, result.getOverall(), config, driver))
                .build();
    }

    private String summarize(ValidationOutcome outcome, double confidence, ThresholdConfig config,
                             ConfidenceFactor driver) {
        switch (outcome) {
            case AUTO_APPROVE:
                return String.format("Confidence %.3f above auto-approve %.3f, driven by %s",
                        confidence, config.getAutoApprove(), driver.getFieldName());
            case AUTO_REJECT:
                return String.format("Confidence %.3f at or below auto-reject %.3f, weakest signal %s",
                        confidence, config.getAutoReject(), driver.getFieldName());
            default:
                return String.format("Confidence %.3f between auto-reject %.3f and auto-approve %.3f, weakest signal %s",
                        confidence, config.getAutoReject(), config.getAutoApprove(), driver.getFieldName());
        }
    }
}
