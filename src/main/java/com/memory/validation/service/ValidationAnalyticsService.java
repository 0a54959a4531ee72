package com.memory.validation.service;

import com.memory.validation.config.AnalyticsConfig;
import com.memory.validation.engine.CoverageAnalyzer;
import com.memory.validation.model.AnalyticsReport;
import com.memory.validation.model.BatchResult;
import com.memory.validation.model.ConfidenceBucket;
import com.memory.validation.model.CoverageAnalysis;
import com.memory.validation.model.EffectivenessMetrics;
import com.memory.validation.model.HealthStatus;
import com.memory.validation.model.QualityDistribution;
import com.memory.validation.model.QualityMetrics;
import com.memory.validation.model.SampledRecords;
import com.memory.validation.model.SamplingEffectiveness;
import com.memory.validation.model.TemporalDistribution;
import com.memory.validation.model.ValidationDecision;
import com.memory.validation.model.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rolling history of batch and sampling runs, turned into performance, health and effectiveness views.
 *
 * Accuracy figures come from the quality monitor's latest metrics; this service never reads feedback itself.
 */
@Service
public class ValidationAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(ValidationAnalyticsService.class);

    private static final int TREND_WINDOW = 20;
    private static final int HEALTH_WINDOW = 5;
    private static final int EFFECTIVENESS_WINDOW = 10;

    private final QualityMonitorService qualityMonitorService;
    private final AnalyticsConfig analyticsConfig;

    private final Deque<BatchRecord> batches = new ArrayDeque<>();
    private final Deque<SampledRecords> samples = new ArrayDeque<>();
    private long totalRecords;
    private long totalProcessingMs;
    private long startedAt = System.currentTimeMillis();

    public ValidationAnalyticsService(QualityMonitorService qualityMonitorService,
                                      AnalyticsConfig analyticsConfig) {
        this.qualityMonitorService = qualityMonitorService;
        this.analyticsConfig = analyticsConfig;
    }

    // ── Intake ──

    public synchronized void recordBatch(BatchResult result) {
        if (result == null) {
            return;
        }
        int records = result.getTotalRecords();
        long durationMs = result.getDurationMs();
        int processed = result.getProcessedCount();
        int approved = count(result, ValidationOutcome.AUTO_APPROVE);
        int rejected = count(result, ValidationOutcome.AUTO_REJECT);

        AnalyticsReport.BatchTrend trend = AnalyticsReport.BatchTrend.builder()
                .batchId(result.getBatchId())
                .recordedAt(System.currentTimeMillis())
                .records(records)
                .throughputPerMinute(round(records / (double) Math.max(1L, durationMs) * 60_000.0))
                .averageConfidence(result.getAverageConfidence())
                .autoApprovalRate(processed > 0 ? round((double) approved / processed) : 0.0)
                .durationMs(durationMs)
                .qualityDistribution(decisionBands(result.getDecisions()))
                .build();

        batches.addLast(new BatchRecord(trend, processed, approved, rejected));
        while (batches.size() > analyticsConfig.getHistorySize()) {
            batches.removeFirst();
        }
        totalRecords += records;
        totalProcessingMs += durationMs;

        log.debug("Batch {} recorded: {} records, {}/min, approve rate {}",
                trend.getBatchId(), records, trend.getThroughputPerMinute(), trend.getAutoApprovalRate());
    }

    public synchronized void recordSampling(SampledRecords sample) {
        if (sample == null) {
            return;
        }
        samples.addLast(sample);
        while (samples.size() > analyticsConfig.getHistorySize()) {
            samples.removeFirst();
        }
    }

    public synchronized void clear() {
        batches.clear();
        samples.clear();
        totalRecords = 0;
        totalProcessingMs = 0;
        startedAt = System.currentTimeMillis();
        log.info("Analytics history cleared");
    }

    // ── Views ──

    public synchronized AnalyticsReport report() {
        QualityMetrics quality = qualityMonitorService.latest();
        long now = System.currentTimeMillis();

        AnalyticsReport.PerformanceSummary performance = AnalyticsReport.PerformanceSummary.builder()
                .totalRecordsProcessed(totalRecords)
                .totalProcessingMs(totalProcessingMs)
                .averageProcessingMs(totalRecords > 0 ? round((double) totalProcessingMs / totalRecords) : 0.0)
                .batchesRecorded(batches.size())
                .uptimeMs(now - startedAt)
                .build();

        return AnalyticsReport.builder()
                .generatedAt(now)
                .accuracy(quality)
                .performance(performance)
                .batchTrends(recent(batches, TREND_WINDOW).stream().map(b -> b.trend).collect(Collectors.toList()))
                .systemHealth(systemHealth(quality, now))
                .recommendations(recommendations(quality, performance))
                .build();
    }

    public synchronized EffectivenessMetrics effectiveness() {
        List<BatchRecord> recent = recent(batches, EFFECTIVENESS_WINDOW);
        QualityMetrics quality = qualityMonitorService.latest();

        double autoApprovalRate = 0.0;
        double workloadReduction = 0.0;
        long processed = 0;
        long approved = 0;
        long decidedWithoutReview = 0;
        for (BatchRecord batch : recent) {
            processed += batch.processed;
            approved += batch.approved;
            decidedWithoutReview += batch.approved + batch.rejected;
        }
        if (processed > 0) {
            autoApprovalRate = (double) approved / processed;
            workloadReduction = (double) decidedWithoutReview / processed;
        }
        double qualityMaintenance = qualityMaintenance(quality);
        double timeEfficiency = recent.isEmpty() ? 0.0 : throughputScore(averageThroughput(recent));

        double overall = autoApprovalRate * 0.3 + workloadReduction * 0.3
                + qualityMaintenance * 0.3 + timeEfficiency * 0.1;

        return EffectivenessMetrics.builder()
                .autoApprovalRate(round(autoApprovalRate))
                .humanWorkloadReduction(round(workloadReduction))
                .qualityMaintenance(round(qualityMaintenance))
                .timeEfficiency(round(timeEfficiency))
                .overallEffectiveness(round(overall))
                .batchesConsidered(recent.size())
                .build();
    }

    public synchronized SamplingEffectiveness samplingEffectiveness() {
        if (samples.isEmpty()) {
            return SamplingEffectiveness.builder()
                    .recommendations(List.of("No sampling data available"))
                    .build();
        }
        double coverageSum = 0.0;
        double efficiencySum = 0.0;
        double representativenessSum = 0.0;
        int lowEmotional = 0;
        int gappy = 0;
        int oversampled = 0;
        for (SampledRecords sample : samples) {
            CoverageAnalysis coverage = sample.getCoverage();
            coverageSum += coverage.getOverallScore();
            efficiencySum += Math.min(1.0, coverage.getOverallScore() / Math.max(0.1, sample.getSamplingRate()));
            representativenessSum += coverage.getEmotionalCoverage().getCoveragePercentage() / 100.0 * 0.4
                    + (coverage.getTemporalCoverage().getDistribution() == TemporalDistribution.EVEN ? 0.8 : 0.4) * 0.3
                    + coverage.getRelationshipCoverage().getCoveragePercentage() / 100.0 * 0.3;
            if (coverage.getEmotionalCoverage().getCoveragePercentage() < 60.0) {
                lowEmotional++;
            }
            if (coverage.getTemporalCoverage().getGaps().size() > 2) {
                gappy++;
            }
            if (sample.getSamplingRate() > 0.5) {
                oversampled++;
            }
        }
        int n = samples.size();
        List<String> recommendations = new ArrayList<>();
        if (lowEmotional > n * 0.5) {
            recommendations.add("Increase emotional diversity in sampling strategy");
        }
        if (gappy > n * 0.3) {
            recommendations.add("Improve temporal distribution in samples");
        }
        if (oversampled > 0) {
            recommendations.add("Optimize sampling rate - current strategy may be over-sampling");
        }
        return SamplingEffectiveness.builder()
                .samplesConsidered(n)
                .averageCoverage(round(coverageSum / n))
                .samplingEfficiency(round(efficiencySum / n))
                .representativenessScore(round(representativenessSum / n))
                .recommendations(List.copyOf(recommendations))
                .build();
    }

    // ── Health ──

    AnalyticsReport.SystemHealth systemHealth(QualityMetrics quality, long now) {
        List<BatchRecord> recent = recent(batches, HEALTH_WINDOW);
        double throughput = averageThroughput(recent);
        boolean hasFeedback = quality != null && quality.getSampleSize() > 0;

        double score;
        List<String> issues = new ArrayList<>();
        if (hasFeedback) {
            double errorScore = 1.0 - (quality.getFalsePositiveRate() + quality.getFalseNegativeRate()) / 2.0;
            score = quality.getAccuracy() * 0.5 + errorScore * 0.3 + throughputScore(throughput) * 0.2;
            if (quality.getAccuracy() < 0.8) {
                issues.add(String.format("Low accuracy: %.1f%%", quality.getAccuracy() * 100));
            }
            if (quality.getFalsePositiveRate() > 0.05) {
                issues.add(String.format("High false positive rate: %.1f%%", quality.getFalsePositiveRate() * 100));
            }
            if (quality.getFalseNegativeRate() > 0.05) {
                issues.add(String.format("High false negative rate: %.1f%%", quality.getFalseNegativeRate() * 100));
            }
        } else {
            score = throughputScore(throughput);
            issues.add("No reviewer feedback yet, accuracy unknown");
        }

        if (recent.isEmpty()) {
            issues.add("No batches processed yet");
        } else {
            if (throughput < analyticsConfig.getTargetThroughputPerMinute() / 2.0) {
                issues.add(String.format("Low throughput: %.1f records/minute", throughput));
            }
            double confidence = 0.0;
            for (BatchRecord batch : recent) {
                confidence += batch.trend.getAverageConfidence();
            }
            confidence /= recent.size();
            if (confidence < 0.6) {
                issues.add(String.format("Low batch confidence: %.1f%%", confidence * 100));
            }
        }

        HealthStatus status = score > 0.8 ? HealthStatus.HEALTHY
                : score > 0.6 ? HealthStatus.WARNING : HealthStatus.CRITICAL;
        if (status != HealthStatus.HEALTHY) {
            log.warn("System health {} (score {}): {}", status, round(score), issues);
        }
        return AnalyticsReport.SystemHealth.builder()
                .status(status)
                .score(round(score))
                .issues(List.copyOf(issues))
                .uptimeMs(now - startedAt)
                .build();
    }

    List<String> recommendations(QualityMetrics quality, AnalyticsReport.PerformanceSummary performance) {
        List<String> recommendations = new ArrayList<>();
        if (quality != null && quality.getSampleSize() > 0) {
            if (quality.getAccuracy() < 0.85) {
                recommendations.add("Consider adjusting confidence thresholds to improve accuracy");
            }
            if (quality.getFalsePositiveRate() > 0.05) {
                recommendations.add("Increase auto-approval threshold to reduce false positives");
            }
            if (quality.getFalseNegativeRate() > 0.05) {
                recommendations.add("Decrease auto-rejection threshold to reduce false negatives");
            }
            if (quality.getConfidenceBuckets() != null) {
                for (ConfidenceBucket bucket : quality.getConfidenceBuckets()) {
                    if (bucket.getCount() > 10
                            && Math.abs(bucket.getAccuracy() - bucket.getAverageConfidence()) > 0.2) {
                        recommendations.add("Recalibrate confidence scoring - accuracy in the "
                                + bucket.getRange() + " band does not match its confidence");
                        break;
                    }
                }
            }
        }
        if (performance.getAverageProcessingMs() > 100) {
            recommendations.add("Optimize processing pipeline to improve throughput");
        }
        return List.copyOf(recommendations);
    }

    // ── Helpers ──

    private static QualityDistribution decisionBands(List<ValidationDecision> decisions) {
        int high = 0;
        int medium = 0;
        int low = 0;
        if (decisions != null) {
            for (ValidationDecision decision : decisions) {
                switch (CoverageAnalyzer.qualityBand(decision.getConfidence())) {
                    case "high": high++; break;
                    case "medium": medium++; break;
                    default: low++;
                }
            }
        }
        return QualityDistribution.builder().high(high).medium(medium).low(low).build();
    }

    private static int count(BatchResult result, ValidationOutcome outcome) {
        if (result.getDecisionCounts() == null) {
            return 0;
        }
        Integer count = result.getDecisionCounts().get(outcome);
        return count != null ? count : 0;
    }

    private static double qualityMaintenance(QualityMetrics quality) {
        if (quality == null || quality.getSampleSize() == 0) {
            return 0.0;
        }
        return quality.getAccuracy() * (1.0 - (quality.getFalsePositiveRate() + quality.getFalseNegativeRate()) / 2.0);
    }

    private double throughputScore(double throughputPerMinute) {
        return Math.min(1.0, throughputPerMinute / analyticsConfig.getTargetThroughputPerMinute());
    }

    private static double averageThroughput(List<BatchRecord> recent) {
        if (recent.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (BatchRecord batch : recent) {
            sum += batch.trend.getThroughputPerMinute();
        }
        return sum / recent.size();
    }

    private static <T> List<T> recent(Deque<T> history, int window) {
        List<T> all = new ArrayList<>(history);
        return all.subList(Math.max(0, all.size() - window), all.size());
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private static final class BatchRecord {
        final AnalyticsReport.BatchTrend trend;
        final int processed;
        final int approved;
        final int rejected;

        BatchRecord(AnalyticsReport.BatchTrend trend, int processed, int approved, int rejected) {
            this.trend = trend;
            this.processed = processed;
            this.approved = approved;
            this.rejected = rejected;
        }
    }
}
