package com.memory.validation.config;

import com.memory.validation.model.QualityMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger pendingReviewCount;
    private final AtomicLong thresholdVersion;
    // Gauges read these in thousandths
    private final AtomicLong accuracyMillis;
    private final AtomicLong falsePositiveMillis;
    private final AtomicLong falseNegativeMillis;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.pendingReviewCount = registry.gauge("review.pending.count", new AtomicInteger(0));
        this.thresholdVersion = registry.gauge("thresholds.version", new AtomicLong(0));
        this.accuracyMillis = new AtomicLong(0);
        this.falsePositiveMillis = new AtomicLong(0);
        this.falseNegativeMillis = new AtomicLong(0);
        registry.gauge("quality.accuracy", accuracyMillis, v -> v.get() / 1000.0);
        registry.gauge("quality.false_positive_rate", falsePositiveMillis, v -> v.get() / 1000.0);
        registry.gauge("quality.false_negative_rate", falseNegativeMillis, v -> v.get() / 1000.0);
    }

    public void recordDecision(String outcome, String priority, double confidence) {
        Counter.builder("validation.decision.count")
                .tag("outcome", outcome)
                .tag("priority", priority)
                .register(registry)
                .increment();

        DistributionSummary.builder("validation.confidence")
                .tag("outcome", outcome)
                .register(registry)
                .record(confidence);
    }

    public void recordMalformedRecord() {
        Counter.builder("validation.malformed.count")
                .register(registry)
                .increment();
    }

    public void recordBatch(int records, int errors, long durationMs, boolean flagged) {
        Counter.builder("batch.count")
                .tag("flagged", String.valueOf(flagged))
                .register(registry)
                .increment();

        DistributionSummary.builder("batch.size")
                .register(registry)
                .record(records);

        Counter.builder("batch.errors.count")
                .register(registry)
                .increment(errors);

        Timer.builder("batch.duration")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordFeedback(String predicted, boolean correct) {
        Counter.builder("feedback.count")
                .tag("predicted", predicted)
                .tag("agreement", correct ? "agree" : "disagree")
                .register(registry)
                .increment();
    }

    public void recordCalibration(String status) {
        Counter.builder("calibration.cycle.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordQualityAlert(String type) {
        Counter.builder("quality.alert.count")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordSample(String strategy, int size, double coverage) {
        Counter.builder("sampling.count")
                .tag("strategy", strategy)
                .register(registry)
                .increment();

        DistributionSummary.builder("sampling.size")
                .register(registry)
                .record(size);

        DistributionSummary.builder("sampling.coverage")
                .register(registry)
                .record(coverage);
    }

    public void updateQuality(QualityMetrics metrics) {
        accuracyMillis.set(Math.round(metrics.getAccuracy() * 1000.0));
        falsePositiveMillis.set(Math.round(metrics.getFalsePositiveRate() * 1000.0));
        falseNegativeMillis.set(Math.round(metrics.getFalseNegativeRate() * 1000.0));
    }

    public void updatePendingReviewCount(int count) {
        pendingReviewCount.set(count);
    }

    public void updateThresholdVersion(long version) {
        thresholdVersion.set(version);
    }
}
