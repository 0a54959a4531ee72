package com.memory.validation.service;

import com.memory.validation.config.MetricsConfig;
import com.memory.validation.config.ReviewQueueConfig;
import com.memory.validation.engine.ConfidenceScorer;
import com.memory.validation.engine.DecisionEngine;
import com.memory.validation.engine.SignificanceAdjustor;
import com.memory.validation.model.ConfidenceResult;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.RecordEvaluation;
import com.memory.validation.model.SignificanceScore;
import com.memory.validation.model.ThresholdConfig;
import com.memory.validation.model.ThresholdVersion;
import com.memory.validation.model.ValidationDecision;
import com.memory.validation.model.ValidationOutcome;
import com.memory.validation.repository.PendingReviewRepository;
import com.memory.validation.repository.ThresholdStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates one memory record end to end.
 *
 * Flow:
 * 1. Extract and clip the four confidence signals, combine them with the snapshot's weights
 * 2. Score emotional significance and derive the thresholds in effect for this record
 * 3. Decide against those thresholds
 * 4. Hold review-required and urgent decisions for human review
 * 5. Record metrics
 */
@Service
public class RecordEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(RecordEvaluationService.class);

    private final ConfidenceScorer confidenceScorer;
    private final SignificanceAdjustor significanceAdjustor;
    private final DecisionEngine decisionEngine;
    private final ThresholdStore thresholdStore;
    private final PendingReviewRepository pendingReviewRepository;
    private final ReviewQueueConfig reviewQueueConfig;
    private final MetricsConfig metricsConfig;

    public RecordEvaluationService(ConfidenceScorer confidenceScorer,
                                   SignificanceAdjustor significanceAdjustor,
                                   DecisionEngine decisionEngine,
                                   ThresholdStore thresholdStore,
                                   PendingReviewRepository pendingReviewRepository,
                                   ReviewQueueConfig reviewQueueConfig,
                                   MetricsConfig metricsConfig) {
        this.confidenceScorer = confidenceScorer;
        this.significanceAdjustor = significanceAdjustor;
        this.decisionEngine = decisionEngine;
        this.thresholdStore = thresholdStore;
        this.pendingReviewRepository = pendingReviewRepository;
        this.reviewQueueConfig = reviewQueueConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "record.evaluate", contextualName = "evaluate-record")
    public RecordEvaluation evaluate(MemoryRecord record) {
        return evaluate(record, thresholdStore.current());
    }

    /**
     * Evaluate against a threshold snapshot the caller already holds.
     * Batches pass the snapshot taken at batch start so every record sees the same version.
     */
    public RecordEvaluation evaluate(MemoryRecord record, ThresholdVersion snapshot) {
        ThresholdConfig base = snapshot.getConfig();
        ConfidenceResult confidence = confidenceScorer.score(record, base);

        SignificanceScore significance = significanceAdjustor.assess(record);
        ThresholdConfig effective = significanceAdjustor.adjust(base, significance);

        ValidationDecision decision = decisionEngine.decide(record.getId(), confidence, effective,
                significance, snapshot.getVersion(), record.getTimestamp());

        if (needsHumanReview(decision)) {
            pendingReviewRepository.save(decision);
            metricsConfig.updatePendingReviewCount(pendingReviewRepository.size());
        }
        metricsConfig.recordDecision(decision.getOutcome().name(), decision.getPriority().name(),
                decision.getConfidence());

        log.debug("Record {} -> {} (confidence={}, significance={}, priority={}, thresholds v{})",
                record.getId(), decision.getOutcome(), decision.getConfidence(),
                decision.getSignificance(), decision.getPriority(), snapshot.getVersion());

        return RecordEvaluation.builder()
                .confidence(confidence.withDecision(decision.getOutcome()))
                .significance(significance)
                .effectiveThresholds(effective)
                .decision(decision)
                .build();
    }

    boolean needsHumanReview(ValidationDecision decision) {
        return decision.getOutcome() == ValidationOutcome.REVIEW_REQUIRED
                || decision.getSignificance() >= reviewQueueConfig.getUrgentSignificance();
    }
}
