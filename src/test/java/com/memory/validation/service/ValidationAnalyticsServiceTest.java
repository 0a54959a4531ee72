package com.memory.validation.service;

import com.memory.validation.config.AnalyticsConfig;
import com.memory.validation.model.AnalyticsReport;
import com.memory.validation.model.ConfidenceBucket;
import com.memory.validation.model.CoverageAnalysis;
import com.memory.validation.model.EffectivenessMetrics;
import com.memory.validation.model.HealthStatus;
import com.memory.validation.model.QualityDistribution;
import com.memory.validation.model.QualityMetrics;
import com.memory.validation.model.SampledRecords;
import com.memory.validation.model.SamplingEffectiveness;
import com.memory.validation.model.TemporalDistribution;
import com.memory.validation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationAnalyticsServiceTest {

    @Mock private QualityMonitorService qualityMonitorService;

    private AnalyticsConfig analyticsConfig;
    private ValidationAnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        analyticsConfig = new AnalyticsConfig();
        analyticsService = new ValidationAnalyticsService(qualityMonitorService, analyticsConfig);
    }

    @Test
    void report_nothingRecorded_criticalWithExplanations() {
        when(qualityMonitorService.latest()).thenReturn(QualityMetrics.empty());

        AnalyticsReport report = analyticsService.report();

        assertThat(report.getSystemHealth().getStatus()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(report.getSystemHealth().getScore()).isZero();
        assertThat(report.getSystemHealth().getIssues())
                .anyMatch(i -> i.startsWith("No reviewer feedback"))
                .anyMatch(i -> i.startsWith("No batches processed"));
        assertThat(report.getBatchTrends()).isEmpty();
        assertThat(report.getRecommendations()).isEmpty();
    }

    @Test
    void recordBatch_trendCarriesThroughputAndBands() {
        when(qualityMonitorService.latest()).thenReturn(QualityMetrics.empty());
        analyticsService.recordBatch(TestDataFactory.createBatchResult(30, 20, 50, 0.85, 1000));

        AnalyticsReport report = analyticsService.report();

        AnalyticsReport.BatchTrend trend = report.getBatchTrends().get(0);
        assertThat(trend.getRecords()).isEqualTo(100);
        assertThat(trend.getThroughputPerMinute()).isCloseTo(6000.0, within(1e-9));
        assertThat(trend.getAutoApprovalRate()).isCloseTo(0.3, within(1e-9));
        assertThat(trend.getQualityDistribution().getHigh()).isEqualTo(100);
        assertThat(report.getPerformance().getTotalRecordsProcessed()).isEqualTo(100);
        assertThat(report.getPerformance().getAverageProcessingMs()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void report_accurateAndFast_healthy() {
        when(qualityMonitorService.latest()).thenReturn(quality(0.95, 0.01, 0.01, List.of()));
        analyticsService.recordBatch(TestDataFactory.createBatchResult(30, 20, 50, 0.8, 1000));

        AnalyticsReport.SystemHealth health = analyticsService.report().getSystemHealth();

        // 0.95*0.5 + (1 - 0.01)*0.3 + 1.0*0.2
        assertThat(health.getScore()).isCloseTo(0.972, within(1e-9));
        assertThat(health.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.getIssues()).isEmpty();
    }

    @Test
    void report_highFalsePositiveRate_issueAndRecommendation() {
        when(qualityMonitorService.latest()).thenReturn(quality(0.9, 0.08, 0.01, List.of()));
        analyticsService.recordBatch(TestDataFactory.createBatchResult(30, 20, 50, 0.8, 1000));

        AnalyticsReport report = analyticsService.report();

        assertThat(report.getSystemHealth().getIssues()).anyMatch(i -> i.startsWith("High false positive rate"));
        assertThat(report.getRecommendations())
                .contains("Increase auto-approval threshold to reduce false positives");
    }

    @Test
    void report_bandAccuracyFarFromConfidence_recommendsRecalibration() {
        ConfidenceBucket overconfident = ConfidenceBucket.builder()
                .range("80-100%").count(40).accuracy(0.55).averageConfidence(0.9).build();
        when(qualityMonitorService.latest()).thenReturn(quality(0.9, 0.01, 0.01, List.of(overconfident)));

        AnalyticsReport report = analyticsService.report();

        assertThat(report.getRecommendations()).anyMatch(r -> r.startsWith("Recalibrate confidence scoring"));
    }

    @Test
    void report_slowLowConfidenceBatches_flagged() {
        when(qualityMonitorService.latest()).thenReturn(quality(0.95, 0.01, 0.01, List.of()));
        // 10 records in 60 s: 10/min and 6 s per record
        analyticsService.recordBatch(TestDataFactory.createBatchResult(1, 4, 5, 0.4, 60_000));

        AnalyticsReport report = analyticsService.report();

        assertThat(report.getSystemHealth().getIssues())
                .anyMatch(i -> i.startsWith("Low throughput"))
                .anyMatch(i -> i.startsWith("Low batch confidence"));
        assertThat(report.getRecommendations()).contains("Optimize processing pipeline to improve throughput");
    }

    @Test
    void effectiveness_onlyLastTenBatchesCount() {
        when(qualityMonitorService.latest()).thenReturn(quality(0.9, 0.02, 0.04, List.of()));
        analyticsService.recordBatch(TestDataFactory.createBatchResult(100, 0, 0, 0.9, 100));
        analyticsService.recordBatch(TestDataFactory.createBatchResult(100, 0, 0, 0.9, 100));
        for (int i = 0; i < 10; i++) {
            analyticsService.recordBatch(TestDataFactory.createBatchResult(30, 20, 50, 0.7, 100));
        }

        EffectivenessMetrics metrics = analyticsService.effectiveness();

        assertThat(metrics.getBatchesConsidered()).isEqualTo(10);
        assertThat(metrics.getAutoApprovalRate()).isCloseTo(0.3, within(1e-9));
        assertThat(metrics.getHumanWorkloadReduction()).isCloseTo(0.8, within(1e-9));
        assertThat(metrics.getQualityMaintenance()).isCloseTo(0.873, within(1e-9));
        assertThat(metrics.getTimeEfficiency()).isCloseTo(1.0, within(1e-9));
        // 0.3*0.3 + 0.8*0.3 + 0.873*0.3 + 1.0*0.1
        assertThat(metrics.getOverallEffectiveness()).isCloseTo(0.692, within(1e-9));
    }

    @Test
    void recordBatch_historyCapped_totalsKeepCounting() {
        analyticsConfig.setHistorySize(3);
        when(qualityMonitorService.latest()).thenReturn(QualityMetrics.empty());
        for (int i = 0; i < 5; i++) {
            analyticsService.recordBatch(TestDataFactory.createBatchResult(5, 5, 0, 0.7, 100));
        }

        AnalyticsReport report = analyticsService.report();

        assertThat(report.getPerformance().getBatchesRecorded()).isEqualTo(3);
        assertThat(report.getBatchTrends()).hasSize(3);
        assertThat(report.getPerformance().getTotalRecordsProcessed()).isEqualTo(50);
    }

    @Test
    void samplingEffectiveness_noSamples_explains() {
        SamplingEffectiveness result = analyticsService.samplingEffectiveness();

        assertThat(result.getSamplesConsidered()).isZero();
        assertThat(result.getRecommendations()).containsExactly("No sampling data available");
    }

    @Test
    void samplingEffectiveness_oversampledEvenSample_scoredAndFlagged() {
        analyticsService.recordSampling(sampled(0.8, 0.8, 100.0, 50.0));

        SamplingEffectiveness result = analyticsService.samplingEffectiveness();

        assertThat(result.getAverageCoverage()).isCloseTo(0.8, within(1e-9));
        assertThat(result.getSamplingEfficiency()).isCloseTo(1.0, within(1e-9));
        // 1.0*0.4 + 0.8*0.3 + 0.5*0.3
        assertThat(result.getRepresentativenessScore()).isCloseTo(0.79, within(1e-9));
        assertThat(result.getRecommendations())
                .containsExactly("Optimize sampling rate - current strategy may be over-sampling");
    }

    @Test
    void clear_dropsHistory() {
        analyticsService.recordBatch(TestDataFactory.createBatchResult(1, 1, 1, 0.7, 100));
        analyticsService.recordSampling(sampled(0.5, 0.1, 40.0, 20.0));

        analyticsService.clear();

        when(qualityMonitorService.latest()).thenReturn(QualityMetrics.empty());
        assertThat(analyticsService.report().getPerformance().getTotalRecordsProcessed()).isZero();
        assertThat(analyticsService.samplingEffectiveness().getSamplesConsidered()).isZero();
    }

    private static QualityMetrics quality(double accuracy, double fp, double fn, List<ConfidenceBucket> buckets) {
        return QualityMetrics.builder()
                .sampleSize(200)
                .accuracy(accuracy)
                .falsePositiveRate(fp)
                .falseNegativeRate(fn)
                .confidenceBuckets(buckets)
                .build();
    }

    private static SampledRecords sampled(double overall, double rate, double emotionalPct, double relationshipPct) {
        CoverageAnalysis coverage = CoverageAnalysis.builder()
                .emotionalCoverage(CoverageAnalysis.EmotionalCoverage.builder()
                        .represented(List.of()).coveragePercentage(emotionalPct).gaps(List.of()).build())
                .temporalCoverage(CoverageAnalysis.TemporalCoverage.builder()
                        .distribution(TemporalDistribution.EVEN).gaps(List.of()).build())
                .relationshipCoverage(CoverageAnalysis.RelationshipCoverage.builder()
                        .represented(List.of()).coveragePercentage(relationshipPct).build())
                .qualityDistribution(QualityDistribution.builder().build())
                .overallScore(overall)
                .build();
        return SampledRecords.builder()
                .samples(List.of())
                .coverage(coverage)
                .samplingRate(rate)
                .strategy("simple-random")
                .build();
    }
}
