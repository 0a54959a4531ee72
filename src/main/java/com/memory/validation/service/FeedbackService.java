package com.memory.validation.service;

import com.memory.validation.config.FeedbackConfig;
import com.memory.validation.config.MetricsConfig;
import com.memory.validation.model.ValidationFeedback;
import com.memory.validation.repository.FeedbackRepository;
import com.memory.validation.repository.PendingReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackRepository feedbackRepository;
    private final PendingReviewRepository pendingReviewRepository;
    private final FeedbackConfig feedbackConfig;
    private final MetricsConfig metricsConfig;

    public FeedbackService(FeedbackRepository feedbackRepository,
                           PendingReviewRepository pendingReviewRepository,
                           FeedbackConfig feedbackConfig,
                           MetricsConfig metricsConfig) {
        this.feedbackRepository = feedbackRepository;
        this.pendingReviewRepository = pendingReviewRepository;
        this.feedbackConfig = feedbackConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Record a human verdict. The record leaves the review queue if it was waiting there.
     *
     * @return the stored feedback, stamped with a submission time if it had none
     */
    public ValidationFeedback submit(ValidationFeedback feedback) {
        validate(feedback);

        ValidationFeedback stored = feedback.getSubmittedAt() > 0 ? feedback
                : feedback.toBuilder().submittedAt(System.currentTimeMillis()).build();
        feedbackRepository.append(stored);

        boolean wasPending = pendingReviewRepository.remove(stored.getRecordId());
        metricsConfig.updatePendingReviewCount(pendingReviewRepository.size());
        metricsConfig.recordFeedback(stored.getPredictedDecision().name(), stored.isCorrect());

        if (!stored.isCorrect()) {
            log.info("Reviewer disagreed on record {}: predicted={}, actual={}, reason={}",
                    stored.getRecordId(), stored.getPredictedDecision(), stored.getActualDecision(),
                    stored.getDisagreementReason());
        } else {
            log.debug("Feedback recorded for record {} (pending={})", stored.getRecordId(), wasPending);
        }
        return stored;
    }

    void validate(ValidationFeedback feedback) {
        if (feedback == null) {
            throw new IllegalArgumentException("Feedback body is required");
        }
        if (feedback.getRecordId() == null || feedback.getRecordId().isBlank()) {
            throw new IllegalArgumentException("recordId is required");
        }
        if (feedback.getPredictedDecision() == null) {
            throw new IllegalArgumentException("predictedDecision is required");
        }
        if (feedback.getActualDecision() == null) {
            throw new IllegalArgumentException("actualDecision is required");
        }
        if (!inUnitRange(feedback.getReviewerConfidence())) {
            throw new IllegalArgumentException("reviewerConfidence must be within [0, 1]");
        }
        if (!inUnitRange(feedback.getPredictedConfidence())) {
            throw new IllegalArgumentException("predictedConfidence must be within [0, 1]");
        }
        if (feedback.getQualityRating() < 1 || feedback.getQualityRating() > 5) {
            throw new IllegalArgumentException("qualityRating must be between 1 and 5");
        }
        if (feedback.getTimeTakenSeconds() < 0 || feedback.getTimeTakenSeconds() > feedbackConfig.getMaxReviewSeconds()) {
            throw new IllegalArgumentException("timeTakenSeconds must be between 0 and " + feedbackConfig.getMaxReviewSeconds());
        }
    }

    private static boolean inUnitRange(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 1.0;
    }
}
