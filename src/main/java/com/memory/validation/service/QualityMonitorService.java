package com.memory.validation.service;

import com.memory.validation.config.MetricsConfig;
import com.memory.validation.config.QualityConfig;
import com.memory.validation.model.AlertSeverity;
import com.memory.validation.model.AlertType;
import com.memory.validation.model.ConfidenceBucket;
import com.memory.validation.model.QualityAlert;
import com.memory.validation.model.QualityMetrics;
import com.memory.validation.model.ValidationFeedback;
import com.memory.validation.model.ValidationOutcome;
import com.memory.validation.repository.FeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks how well automated verdicts agree with later human verdicts over a sliding window.
 * The only writer of the published metrics and alerts; everyone else reads snapshots.
 */
@Service
public class QualityMonitorService {

    private static final Logger log = LoggerFactory.getLogger(QualityMonitorService.class);

    private static final String[] BUCKET_LABELS = {"0-20%", "20-40%", "40-60%", "60-80%", "80-100%"};

    private final FeedbackRepository feedbackRepository;
    private final QualityConfig qualityConfig;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<QualityMetrics> latest = new AtomicReference<>(QualityMetrics.empty());
    private final AtomicReference<List<QualityAlert>> alerts = new AtomicReference<>(Collections.emptyList());

    public QualityMonitorService(FeedbackRepository feedbackRepository,
                                 QualityConfig qualityConfig,
                                 MetricsConfig metricsConfig) {
        this.feedbackRepository = feedbackRepository;
        this.qualityConfig = qualityConfig;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(fixedRateString = "${validation.quality.refresh-interval-minutes:5}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "1")
    public synchronized QualityMetrics refresh() {
        List<ValidationFeedback> window = feedbackRepository.recent(qualityConfig.getWindowSize());
        QualityMetrics previous = latest.get();
        QualityMetrics metrics = compute(window, previous);
        List<QualityAlert> raised = checkAlerts(metrics);

        latest.set(metrics);
        alerts.set(raised);
        metricsConfig.updateQuality(metrics);

        for (QualityAlert alert : raised) {
            metricsConfig.recordQualityAlert(alert.getType().name());
            log.warn("Quality alert [{}] {}: {}", alert.getSeverity(), alert.getType(), alert.getMessage());
        }
        log.info("Quality refreshed: {} samples, accuracy={}, fp={}, fn={}, trend={}",
                metrics.getSampleSize(), metrics.getAccuracy(), metrics.getFalsePositiveRate(),
                metrics.getFalseNegativeRate(), metrics.getAccuracyTrend());
        return metrics;
    }

    public QualityMetrics latest() {
        return latest.get();
    }

    public List<QualityAlert> alerts() {
        return alerts.get();
    }

    QualityMetrics compute(List<ValidationFeedback> window, QualityMetrics previous) {
        int total = window.size();
        if (total == 0) {
            return QualityMetrics.builder()
                    .confidenceBuckets(Collections.emptyList())
                    .computedAt(System.currentTimeMillis())
                    .build();
        }

        int correct = 0;
        int approveTotal = 0;
        int approveCorrect = 0;
        int rejectTotal = 0;
        int rejectCorrect = 0;
        int falsePositives = 0;
        int falseNegatives = 0;
        int[] bucketCounts = new int[BUCKET_LABELS.length];
        int[] bucketCorrect = new int[BUCKET_LABELS.length];
        double[] bucketConfidence = new double[BUCKET_LABELS.length];

        for (ValidationFeedback feedback : window) {
            boolean isCorrect = feedback.isCorrect();
            if (isCorrect) correct++;
            if (feedback.isFalsePositive()) falsePositives++;
            if (feedback.isFalseNegative()) falseNegatives++;

            if (feedback.getPredictedDecision() == ValidationOutcome.AUTO_APPROVE) {
                approveTotal++;
                if (isCorrect) approveCorrect++;
            } else if (feedback.getPredictedDecision() == ValidationOutcome.AUTO_REJECT) {
                rejectTotal++;
                if (isCorrect) rejectCorrect++;
            }

            int bucket = Math.min(BUCKET_LABELS.length - 1,
                    (int) Math.floor(Math.max(0.0, feedback.getPredictedConfidence()) * BUCKET_LABELS.length));
            bucketCounts[bucket]++;
            bucketConfidence[bucket] += feedback.getPredictedConfidence();
            if (isCorrect) bucketCorrect[bucket]++;
        }

        List<ConfidenceBucket> buckets = new ArrayList<>();
        for (int i = 0; i < BUCKET_LABELS.length; i++) {
            if (bucketCounts[i] == 0) continue;
            buckets.add(ConfidenceBucket.builder()
                    .range(BUCKET_LABELS[i])
                    .count(bucketCounts[i])
                    .accuracy(round((double) bucketCorrect[i] / bucketCounts[i]))
                    .averageConfidence(round(bucketConfidence[i] / bucketCounts[i]))
                    .build());
        }

        double accuracy = (double) correct / total;
        double trend = previous != null && previous.getSampleSize() > 0 ? accuracy - previous.getAccuracy() : 0.0;

        return QualityMetrics.builder()
                .sampleSize(total)
                .accuracy(round(accuracy))
                .autoApproveSamples(approveTotal)
                .autoApproveAccuracy(approveTotal > 0 ? round((double) approveCorrect / approveTotal) : 0.0)
                .autoRejectSamples(rejectTotal)
                .autoRejectAccuracy(rejectTotal > 0 ? round((double) rejectCorrect / rejectTotal) : 0.0)
                .falsePositiveRate(round((double) falsePositives / total))
                .falseNegativeRate(round((double) falseNegatives / total))
                .reviewTimeReduction(round((double) (approveCorrect + rejectCorrect) / total))
                .accuracyTrend(round(trend))
                .confidenceBuckets(Collections.unmodifiableList(buckets))
                .computedAt(System.currentTimeMillis())
                .build();
    }

    List<QualityAlert> checkAlerts(QualityMetrics metrics) {
        if (metrics.getSampleSize() < qualityConfig.getMinSamplesForAlerts()) {
            return Collections.emptyList();
        }
        List<QualityAlert> raised = new ArrayList<>();

        if (metrics.getAutoApproveSamples() > 0
                && metrics.getAutoApproveAccuracy() < qualityConfig.getMinAutoApproveAccuracy()) {
            raised.add(QualityAlert.builder()
                    .type(AlertType.LOW_AUTO_APPROVE_ACCURACY)
                    .severity(AlertSeverity.HIGH)
                    .message(String.format("Auto-approve accuracy %.3f is below %.3f",
                            metrics.getAutoApproveAccuracy(), qualityConfig.getMinAutoApproveAccuracy()))
                    .recommendedAction("Recalibrate thresholds")
                    .observed(metrics.getAutoApproveAccuracy())
                    .limit(qualityConfig.getMinAutoApproveAccuracy())
                    .build());
        }
        if (metrics.getFalsePositiveRate() > qualityConfig.getMaxFalsePositiveRate()) {
            raised.add(QualityAlert.builder()
                    .type(AlertType.HIGH_FALSE_POSITIVE_RATE)
                    .severity(AlertSeverity.MEDIUM)
                    .message(String.format("False positive rate %.3f exceeds %.3f",
                            metrics.getFalsePositiveRate(), qualityConfig.getMaxFalsePositiveRate()))
                    .recommendedAction("Raise the auto-approve threshold")
                    .observed(metrics.getFalsePositiveRate())
                    .limit(qualityConfig.getMaxFalsePositiveRate())
                    .build());
        }
        if (metrics.getFalseNegativeRate() > qualityConfig.getMaxFalseNegativeRate()) {
            raised.add(QualityAlert.builder()
                    .type(AlertType.HIGH_FALSE_NEGATIVE_RATE)
                    .severity(AlertSeverity.MEDIUM)
                    .message(String.format("False negative rate %.3f exceeds %.3f",
                            metrics.getFalseNegativeRate(), qualityConfig.getMaxFalseNegativeRate()))
                    .recommendedAction("Lower the auto-reject threshold")
                    .observed(metrics.getFalseNegativeRate())
                    .limit(qualityConfig.getMaxFalseNegativeRate())
                    .build());
        }
        return Collections.unmodifiableList(raised);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
