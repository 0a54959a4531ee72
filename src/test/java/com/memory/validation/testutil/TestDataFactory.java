package com.memory.validation.testutil;

import com.memory.validation.model.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    public static MemoryRecord createRecord(String id, double extraction, double coherence,
                                            double relationship, double context) {
        return MemoryRecord.builder()
                .id(id)
                .content("We talked through the move and it finally felt settled.")
                .timestamp(System.currentTimeMillis())
                .emotionalAnalysis(neutralAnalysis())
                .extractionConfidence(extraction)
                .emotionalCoherence(coherence)
                .relationshipAccuracy(relationship)
                .contextQuality(context)
                .build();
    }

    /**
     * A record whose four signals are all {@code confidence}, so the overall confidence equals it under any weights.
     */
    public static MemoryRecord createUniformRecord(String id, double confidence) {
        return createRecord(id, confidence, confidence, confidence, confidence);
    }

    public static MemoryRecord createSignificantRecord(String id, double extraction, double coherence,
                                                       double relationship, double context) {
        return MemoryRecord.builder()
                .id(id)
                .content("The night everything fell apart and we rebuilt it.")
                .timestamp(System.currentTimeMillis())
                .emotionalAnalysis(EmotionalAnalysis.builder()
                        .moodScore(0.5)
                        .trajectory(TrajectoryDirection.VOLATILE)
                        .pattern(pattern(PatternType.VULNERABILITY, 1.0))
                        .pattern(pattern(PatternType.SUPPORT_SEEKING, 1.0))
                        .pattern(pattern(PatternType.GROWTH, 1.0))
                        .build())
                .relationshipDynamics(RelationshipDynamics.builder()
                        .intimacyLevel(DynamicsLevel.HIGH)
                        .conflictLevel(DynamicsLevel.HIGH)
                        .supportLevel(SupportLevel.NEGATIVE)
                        .build())
                .extractionConfidence(extraction)
                .emotionalCoherence(coherence)
                .relationshipAccuracy(relationship)
                .contextQuality(context)
                .build();
    }

    public static MemoryRecord createMalformedRecord(String id) {
        return MemoryRecord.builder()
                .id(id)
                .timestamp(System.currentTimeMillis())
                .extractionConfidence(0.8)
                .emotionalCoherence(Double.NaN)
                .relationshipAccuracy(0.7)
                .build();
    }

    public static EmotionalAnalysis neutralAnalysis() {
        return EmotionalAnalysis.builder()
                .moodScore(5.0)
                .trajectory(TrajectoryDirection.STABLE)
                .build();
    }

    public static EmotionalPattern pattern(PatternType type, double significance) {
        return EmotionalPattern.builder().type(type).significance(significance).build();
    }

    public static ConfidenceFactors factors(double extraction, double coherence, double relationship, double context) {
        return ConfidenceFactors.builder()
                .extractionConfidence(extraction)
                .emotionalCoherence(coherence)
                .relationshipAccuracy(relationship)
                .contextQuality(context)
                .build();
    }

    public static SignificanceScore significance(double value) {
        return SignificanceScore.builder()
                .value(value)
                .factors(SignificanceFactors.builder().build())
                .thresholdAdjustment(0.0)
                .build();
    }

    public static ValidationDecision createDecision(String recordId, ValidationOutcome outcome, ReviewPriority priority,
                                                    double confidence, double significance,
                                                    double boundaryDistance, long recordTimestamp) {
        return ValidationDecision.builder()
                .recordId(recordId)
                .outcome(outcome)
                .confidence(confidence)
                .priority(priority)
                .estimatedReviewSeconds(60)
                .significance(significance)
                .boundaryDistance(boundaryDistance)
                .recordTimestamp(recordTimestamp)
                .thresholdVersion(1L)
                .decidedAt(System.currentTimeMillis())
                .reasoning(DecisionReasoning.builder()
                        .uncertaintyAreas(List.of())
                        .strengths(List.of())
                        .summary("test")
                        .build())
                .build();
    }

    public static ValidationFeedback createFeedback(String recordId, ValidationOutcome predicted,
                                                    HumanDecision actual, double predictedConfidence) {
        return ValidationFeedback.builder()
                .recordId(recordId)
                .predictedDecision(predicted)
                .actualDecision(actual)
                .reviewerConfidence(0.9)
                .timeTakenSeconds(45)
                .qualityRating(4)
                .predictedConfidence(predictedConfidence)
                .submittedAt(System.currentTimeMillis())
                .build();
    }

    /**
     * {@code count} feedback items, {@code wrongEvery}-th of them wrong (0 = all correct), alternating approve/reject.
     */
    public static List<ValidationFeedback> createFeedbackWindow(int count, int wrongEvery) {
        List<ValidationFeedback> window = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            boolean approve = i % 2 == 0;
            boolean wrong = wrongEvery > 0 && i % wrongEvery == 0;
            HumanDecision actual = approve ^ wrong ? HumanDecision.APPROVED : HumanDecision.REJECTED;
            window.add(createFeedback("MEM-" + i,
                    approve ? ValidationOutcome.AUTO_APPROVE : ValidationOutcome.AUTO_REJECT,
                    actual, approve ? 0.9 : 0.2));
        }
        return window;
    }

    /**
     * Record {@code index} of a population that cycles through trajectories, patterns, support and conflict
     * levels and the three extraction-confidence bands, one record every {@code spacingMillis}.
     */
    public static MemoryRecord createSamplingRecord(int index, long start, long spacingMillis) {
        double[] bands = {0.9, 0.6, 0.3};
        return MemoryRecord.builder()
                .id("MEM-" + index)
                .content("Sampled memory " + index)
                .timestamp(start + index * spacingMillis)
                .emotionalAnalysis(EmotionalAnalysis.builder()
                        .moodScore(5.0)
                        .trajectory(TrajectoryDirection.values()[index % TrajectoryDirection.values().length])
                        .pattern(pattern(PatternType.values()[index % PatternType.values().length], 0.5))
                        .build())
                .relationshipDynamics(RelationshipDynamics.builder()
                        .intimacyLevel(DynamicsLevel.MEDIUM)
                        .supportLevel(SupportLevel.values()[index % SupportLevel.values().length])
                        .conflictLevel(DynamicsLevel.values()[(index / 4) % DynamicsLevel.values().length])
                        .build())
                .extractionConfidence(bands[index % bands.length])
                .emotionalCoherence(0.8)
                .relationshipAccuracy(0.8)
                .contextQuality(0.8)
                .build();
    }

    public static List<MemoryRecord> createSamplingPopulation(int count, long start, long spacingMillis) {
        List<MemoryRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(createSamplingRecord(i, start, spacingMillis));
        }
        return records;
    }

    public static MemoryRecord createStableRecord(String id, long timestamp, TrajectoryDirection trajectory,
                                                  Double extraction) {
        return MemoryRecord.builder()
                .id(id)
                .content("Quiet evening, nothing new.")
                .timestamp(timestamp)
                .emotionalAnalysis(EmotionalAnalysis.builder().moodScore(5.0).trajectory(trajectory).build())
                .relationshipDynamics(RelationshipDynamics.builder()
                        .intimacyLevel(DynamicsLevel.LOW)
                        .supportLevel(SupportLevel.HIGH)
                        .conflictLevel(DynamicsLevel.NONE)
                        .build())
                .extractionConfidence(extraction)
                .emotionalCoherence(0.8)
                .relationshipAccuracy(0.8)
                .contextQuality(0.8)
                .build();
    }

    /**
     * A finished batch of {@code approved + review + rejected} decisions, all at {@code confidence}.
     */
    public static BatchResult createBatchResult(int approved, int review, int rejected,
                                                double confidence, long durationMs) {
        List<ValidationDecision> decisions = new ArrayList<>();
        Map<ValidationOutcome, Integer> counts = new EnumMap<>(ValidationOutcome.class);
        counts.put(ValidationOutcome.AUTO_APPROVE, approved);
        counts.put(ValidationOutcome.REVIEW_REQUIRED, review);
        counts.put(ValidationOutcome.AUTO_REJECT, rejected);
        for (Map.Entry<ValidationOutcome, Integer> entry : counts.entrySet()) {
            for (int i = 0; i < entry.getValue(); i++) {
                decisions.add(createDecision("MEM-" + decisions.size(), entry.getKey(), ReviewPriority.LOW,
                        confidence, 2.0, 0.1, System.currentTimeMillis()));
            }
        }
        return BatchResult.builder()
                .batchId("batch-" + System.nanoTime())
                .thresholdVersion(1L)
                .totalRecords(decisions.size())
                .processedCount(decisions.size())
                .decisionCounts(counts)
                .averageConfidence(confidence)
                .durationMs(durationMs)
                .workerCount(1)
                .decisions(decisions)
                .errors(List.of())
                .build();
    }

    public static ThresholdVersion version(long version, ThresholdConfig config) {
        return ThresholdVersion.builder()
                .version(version)
                .config(config)
                .source(ConfigSource.STARTUP)
                .reason("test")
                .activatedAt(System.currentTimeMillis())
                .build();
    }
}
