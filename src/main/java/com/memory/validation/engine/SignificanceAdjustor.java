package com.memory.validation.engine;

import com.memory.validation.model.DynamicsLevel;
import com.memory.validation.model.EmotionalAnalysis;
import com.memory.validation.model.EmotionalPattern;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.RelationshipDynamics;
import com.memory.validation.model.SignificanceFactors;
import com.memory.validation.model.SignificanceScore;
import com.memory.validation.model.SupportLevel;
import com.memory.validation.model.ThresholdConfig;
import com.memory.validation.model.TrajectoryDirection;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/**
 * Scores the emotional significance of a record and derives a per-evaluation threshold policy from it.
 *
 * Significance (0-10) = 0.35·mood magnitude + 0.25·relationship impact
 *                     + 0.25·psychological markers + 0.15·turning-point potential
 *
 * Significant memories deserve more scrutiny, so a high score narrows the automated bands.
 * Narrowing is applied to a copy; the shared ThresholdConfig is never touched.
 */
@Component
public class SignificanceAdjustor {

    static final double MOOD_WEIGHT = 0.35;
    static final double RELATIONSHIP_WEIGHT = 0.25;
    static final double MARKER_WEIGHT = 0.25;
    static final double TURNING_POINT_WEIGHT = 0.15;

    private static final double NEUTRAL_MOOD = 5.0;
    private static final double UNKNOWN_RELATIONSHIP_IMPACT = 3.0;

    private final ThresholdShiftTable shiftTable;

    public SignificanceAdjustor() {
        this(ThresholdShiftTable.standard());
    }

    SignificanceAdjustor(ThresholdShiftTable shiftTable) {
        this.shiftTable = shiftTable;
    }

    public SignificanceScore assess(MemoryRecord record) {
        EmotionalAnalysis analysis = record.getEmotionalAnalysis();
        double mood = analysis != null ? analysis.getMoodScore() : NEUTRAL_MOOD;
        List<EmotionalPattern> patterns = analysis != null && analysis.getPatterns() != null
                ? analysis.getPatterns() : Collections.emptyList();
        TrajectoryDirection trajectory = analysis != null ? analysis.getTrajectory() : null;

        SignificanceFactors factors = SignificanceFactors.builder()
                .moodMagnitude(moodMagnitude(mood))
                .relationshipImpact(relationshipImpact(record.getRelationshipDynamics()))
                .psychologicalMarkers(psychologicalMarkers(patterns))
                .turningPointPotential(turningPointPotential(trajectory, patterns))
                .build();

        double value = MOOD_WEIGHT * factors.getMoodMagnitude()
                + RELATIONSHIP_WEIGHT * factors.getRelationshipImpact()
                + MARKER_WEIGHT * factors.getPsychologicalMarkers()
                + TURNING_POINT_WEIGHT * factors.getTurningPointPotential();
        value = clamp(value, 0.0, 10.0);

        double shift = clamp(shiftTable.shiftFor(value), -SignificanceScore.MAX_ADJUSTMENT, SignificanceScore.MAX_ADJUSTMENT);

        return SignificanceScore.builder()
                .value(Math.round(value * 1000.0) / 1000.0)
                .factors(factors)
                .thresholdAdjustment(shift)
                .build();
    }

    /**
     * Derive the thresholds in effect for one evaluation.
     * Only a negative (tightening) shift is applied: autoApprove moves up, reviewRequired and
     * autoReject move down, so both automated bands shrink. Positive shifts are ignored.
     */
    public ThresholdConfig adjust(ThresholdConfig config, SignificanceScore significance) {
        double narrowing = Math.min(SignificanceScore.MAX_ADJUSTMENT,
                -Math.min(0.0, significance.getThresholdAdjustment()));
        if (narrowing == 0.0) {
            return config;
        }
        double approve = Math.min(1.0, config.getAutoApprove() + narrowing);
        double reject = Math.max(0.0, config.getAutoReject() - narrowing);
        double review = Math.max(reject, config.getReviewRequired() - narrowing);
        return config.toBuilder()
                .autoApprove(approve)
                .reviewRequired(review)
                .autoReject(reject)
                .build();
    }

    // Distance from a neutral mood of 5, stretched onto 0-10
    static double moodMagnitude(double moodScore) {
        return Math.min(10.0, Math.abs(clamp(moodScore, 0.0, 10.0) - NEUTRAL_MOOD) * 2.0);
    }

    static double relationshipImpact(RelationshipDynamics dynamics) {
        if (dynamics == null) {
            return UNKNOWN_RELATIONSHIP_IMPACT;
        }
        double impact = 2.0;
        impact += intimacyContribution(dynamics.getIntimacyLevel());
        impact += conflictContribution(dynamics.getConflictLevel());
        impact += supportContribution(dynamics.getSupportLevel());
        return Math.min(10.0, impact);
    }

    /**
     * Combined strength of the detected patterns: 10·(1 − Π(1 − markerWeight·significance)).
     * Several weak markers add up without ever exceeding 10.
     */
    static double psychologicalMarkers(List<EmotionalPattern> patterns) {
        double absent = 1.0;
        for (EmotionalPattern pattern : patterns) {
            if (pattern == null || pattern.getType() == null) {
                continue;
            }
            double strength = pattern.getType().getMarkerWeight() * clamp(pattern.getSignificance(), 0.0, 1.0);
            absent *= (1.0 - strength);
        }
        return 10.0 * (1.0 - absent);
    }

    static double turningPointPotential(TrajectoryDirection trajectory, List<EmotionalPattern> patterns) {
        double base = trajectory != null ? trajectory.getTurningPointBase() : TrajectoryDirection.STABLE.getTurningPointBase();
        double strongest = 0.0;
        for (EmotionalPattern pattern : patterns) {
            if (pattern != null && pattern.getType() != null && pattern.getType().signalsTurningPoint()) {
                strongest = Math.max(strongest, clamp(pattern.getSignificance(), 0.0, 1.0));
            }
        }
        return Math.min(10.0, base + 2.0 * strongest);
    }

    private static double intimacyContribution(DynamicsLevel level) {
        if (level == null) {
            return 0.0;
        }
        switch (level) {
            case HIGH: return 3.0;
            case MEDIUM: return 1.5;
            case LOW: return 0.5;
            default: return 0.0;
        }
    }

    private static double conflictContribution(DynamicsLevel level) {
        if (level == null) {
            return 0.0;
        }
        switch (level) {
            case HIGH: return 3.0;
            case MEDIUM: return 2.0;
            case LOW: return 0.5;
            default: return 0.0;
        }
    }

    private static double supportContribution(SupportLevel level) {
        if (level == null) {
            return 0.0;
        }
        switch (level) {
            case NEGATIVE: return 2.0;
            case LOW: return 1.0;
            default: return 0.5;
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
