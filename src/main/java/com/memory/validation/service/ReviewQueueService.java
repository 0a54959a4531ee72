package com.memory.validation.service;

import com.memory.validation.config.ReviewQueueConfig;
import com.memory.validation.model.ReviewBucket;
import com.memory.validation.model.ReviewQueueEntry;
import com.memory.validation.model.ValidationDecision;
import com.memory.validation.model.ValidationOutcome;
import com.memory.validation.repository.PendingReviewRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orders decisions awaiting human review.
 *
 * Buckets: CRITICAL, then HIGH, then everything else. CRITICAL is ordered by urgency
 * (significance plus a bonus for sitting near a cut point); the others by
 * 0.7·significance + 0.3·recency. Ties go to the lower record id.
 * The order is rebuilt on every read and never stored.
 */
@Service
public class ReviewQueueService {

    static final double PROXIMITY_WINDOW = 0.05;

    private final PendingReviewRepository pendingReviewRepository;
    private final ReviewQueueConfig reviewQueueConfig;

    public ReviewQueueService(PendingReviewRepository pendingReviewRepository,
                              ReviewQueueConfig reviewQueueConfig) {
        this.pendingReviewRepository = pendingReviewRepository;
        this.reviewQueueConfig = reviewQueueConfig;
    }

    public List<ReviewQueueEntry> currentQueue() {
        return build(pendingReviewRepository.findAll(), System.currentTimeMillis());
    }

    public List<ReviewQueueEntry> page(int limit) {
        List<ReviewQueueEntry> queue = currentQueue();
        int size = limit > 0 ? limit : reviewQueueConfig.getDefaultPageSize();
        return queue.size() <= size ? queue : new ArrayList<>(queue.subList(0, size));
    }

    public List<ReviewQueueEntry> build(List<ValidationDecision> candidates, long now) {
        Map<ReviewBucket, List<ReviewQueueEntry>> buckets = new EnumMap<>(ReviewBucket.class);
        for (ReviewBucket bucket : ReviewBucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }

        for (ValidationDecision decision : candidates) {
            if (!isCandidate(decision)) {
                continue;
            }
            ReviewBucket bucket = bucketOf(decision);
            buckets.get(bucket).add(ReviewQueueEntry.builder()
                    .bucket(bucket)
                    .urgency(round(urgency(decision)))
                    .blendedScore(round(blendedScore(decision, now)))
                    .decision(decision)
                    .build());
        }

        Comparator<ReviewQueueEntry> byRecordId = Comparator.comparing(e -> e.getDecision().getRecordId());
        buckets.get(ReviewBucket.CRITICAL).sort(
                Comparator.comparingDouble(ReviewQueueEntry::getUrgency).reversed().thenComparing(byRecordId));
        Comparator<ReviewQueueEntry> byBlended =
                Comparator.comparingDouble(ReviewQueueEntry::getBlendedScore).reversed().thenComparing(byRecordId);
        buckets.get(ReviewBucket.HIGH).sort(byBlended);
        buckets.get(ReviewBucket.STANDARD).sort(byBlended);

        List<ReviewQueueEntry> ordered = new ArrayList<>(candidates.size());
        int rank = 1;
        for (ReviewBucket bucket : ReviewBucket.values()) {
            for (ReviewQueueEntry entry : buckets.get(bucket)) {
                ordered.add(entry.toBuilder().rank(rank++).build());
            }
        }
        return ordered;
    }

    boolean isCandidate(ValidationDecision decision) {
        return decision.getOutcome() == ValidationOutcome.REVIEW_REQUIRED
                || decision.getSignificance() >= reviewQueueConfig.getUrgentSignificance();
    }

    static ReviewBucket bucketOf(ValidationDecision decision) {
        switch (decision.getPriority()) {
            case CRITICAL: return ReviewBucket.CRITICAL;
            case HIGH: return ReviewBucket.HIGH;
            default: return ReviewBucket.STANDARD;
        }
    }

    static double urgency(ValidationDecision decision) {
        double bonus = (PROXIMITY_WINDOW - decision.getBoundaryDistance()) / PROXIMITY_WINDOW;
        return decision.getSignificance() + Math.max(0.0, Math.min(1.0, bonus));
    }

    double blendedScore(ValidationDecision decision, long now) {
        return reviewQueueConfig.getSignificanceWeight() * decision.getSignificance()
                + reviewQueueConfig.getRecencyWeight() * recency(decision.getRecordTimestamp(), now);
    }

    /**
     * 10 for a record from right now, falling linearly to 0 at the end of the recency window.
     */
    double recency(long recordTimestamp, long now) {
        double windowMs = Math.max(1L, reviewQueueConfig.getRecencyWindowHours()) * 3_600_000.0;
        double age = Math.max(0L, now - recordTimestamp);
        return 10.0 * Math.max(0.0, 1.0 - age / windowMs);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
