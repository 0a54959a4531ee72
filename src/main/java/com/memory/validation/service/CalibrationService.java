package com.memory.validation.service;

import com.memory.validation.config.CalibrationConfig;
import com.memory.validation.config.MetricsConfig;
import com.memory.validation.engine.DecisionEngine;
import com.memory.validation.exception.InvalidThresholdConfigException;
import com.memory.validation.model.BiasDirection;
import com.memory.validation.model.BiasReport;
import com.memory.validation.model.CalibrationAdjustment;
import com.memory.validation.model.CalibrationStatus;
import com.memory.validation.model.ConfidenceFactor;
import com.memory.validation.model.ConfidenceFactors;
import com.memory.validation.model.ConfigSource;
import com.memory.validation.model.FactorWeights;
import com.memory.validation.model.HumanDecision;
import com.memory.validation.model.QualityMetrics;
import com.memory.validation.model.ThresholdConfig;
import com.memory.validation.model.ThresholdVersion;
import com.memory.validation.model.ValidationFeedback;
import com.memory.validation.model.ValidationOutcome;
import com.memory.validation.repository.FeedbackRepository;
import com.memory.validation.repository.ThresholdStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Owns the threshold store: the only component that publishes new threshold versions.
 *
 * A cycle reads the recent feedback window, proposes bounded threshold and weight changes,
 * replays the window under the proposal and publishes it only if the replay does not get worse.
 * Every threshold moves by at most {@code maxThresholdStep} per cycle.
 */
@Service
public class CalibrationService {

    private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

    private static final double EPSILON = 1e-9;

    private final ThresholdStore thresholdStore;
    private final FeedbackRepository feedbackRepository;
    private final QualityMonitorService qualityMonitorService;
    private final DecisionEngine decisionEngine;
    private final CalibrationConfig calibrationConfig;
    private final MetricsConfig metricsConfig;

    public CalibrationService(ThresholdStore thresholdStore,
                              FeedbackRepository feedbackRepository,
                              QualityMonitorService qualityMonitorService,
                              DecisionEngine decisionEngine,
                              CalibrationConfig calibrationConfig,
                              MetricsConfig metricsConfig) {
        this.thresholdStore = thresholdStore;
        this.feedbackRepository = feedbackRepository;
        this.qualityMonitorService = qualityMonitorService;
        this.decisionEngine = decisionEngine;
        this.calibrationConfig = calibrationConfig;
        this.metricsConfig = metricsConfig;
        metricsConfig.updateThresholdVersion(thresholdStore.current().getVersion());
    }

    /**
     * Compute what a cycle would do without publishing anything.
     */
    public CalibrationAdjustment propose() {
        CalibrationAdjustment adjustment = evaluate();
        if (adjustment.getStatus() == CalibrationStatus.APPLIED) {
            return adjustment.toBuilder().status(CalibrationStatus.PROPOSED).build();
        }
        return adjustment;
    }

    @Scheduled(fixedRateString = "${validation.calibration.interval-hours:6}",
               timeUnit = TimeUnit.HOURS,
               initialDelayString = "1")
    public void scheduledCycle() {
        if (!calibrationConfig.isEnabled()) {
            log.debug("Calibration disabled, skipping scheduled cycle");
            return;
        }
        runCycle();
    }

    @Observed(name = "calibration.cycle", contextualName = "calibration-cycle")
    public synchronized CalibrationAdjustment runCycle() {
        log.info("Starting calibration cycle...");
        CalibrationAdjustment adjustment = evaluate();

        if (adjustment.getStatus() == CalibrationStatus.APPLIED) {
            ThresholdVersion published = thresholdStore.publish(adjustment.getProposed(),
                    ConfigSource.CALIBRATION, String.join("; ", adjustment.getReasons()));
            metricsConfig.updateThresholdVersion(published.getVersion());
            adjustment = adjustment.toBuilder().appliedVersion(published.getVersion()).build();
        } else if (adjustment.getStatus() == CalibrationStatus.REJECTED) {
            log.warn("Calibration proposal rejected: {}", adjustment.getReasons());
        }

        metricsConfig.recordCalibration(adjustment.getStatus().name());
        log.info("Calibration cycle complete: status={}, samples={}, deltas approve={} review={} reject={}",
                adjustment.getStatus(), adjustment.getSampleSize(), adjustment.getAutoApproveDelta(),
                adjustment.getReviewRequiredDelta(), adjustment.getAutoRejectDelta());
        return adjustment;
    }

    /**
     * Operator replacement of the whole configuration. The config has already passed its own invariant checks.
     */
    public synchronized ThresholdVersion replaceConfig(ThresholdConfig config, String reason) {
        ThresholdVersion published = thresholdStore.publish(config, ConfigSource.OPERATOR,
                reason != null ? reason : "Operator update");
        metricsConfig.updateThresholdVersion(published.getVersion());
        return published;
    }

    public synchronized Optional<ThresholdVersion> rollback() {
        Optional<ThresholdVersion> restored = thresholdStore.rollback();
        restored.ifPresent(v -> metricsConfig.updateThresholdVersion(v.getVersion()));
        return restored;
    }

    public ThresholdVersion current() {
        return thresholdStore.current();
    }

    public List<ThresholdVersion> history() {
        return thresholdStore.history();
    }

    CalibrationAdjustment evaluate() {
        ThresholdConfig current = thresholdStore.currentConfig();
        List<ValidationFeedback> window = feedbackRepository.recent(calibrationConfig.getWindowSize());
        int n = window.size();

        CalibrationAdjustment.CalibrationAdjustmentBuilder result = CalibrationAdjustment.builder()
                .previous(current)
                .proposed(current)
                .sampleSize(n)
                .bias(BiasReport.none())
                .evaluatedAt(System.currentTimeMillis());

        if (n < calibrationConfig.getMinSamples()) {
            return result.status(CalibrationStatus.DEFERRED)
                    .reasons(List.of(String.format("Only %d feedback samples, need %d", n, calibrationConfig.getMinSamples())))
                    .build();
        }

        QualityMetrics quality = qualityMonitorService.latest();
        if (quality.getSampleSize() == 0) {
            return result.status(CalibrationStatus.DEFERRED)
                    .reasons(List.of("No quality metrics computed yet"))
                    .build();
        }
        if (quality.getAccuracy() < calibrationConfig.getMinAccuracy()) {
            return result.status(CalibrationStatus.DEFERRED)
                    .reasons(List.of(String.format("Accuracy %.3f below %.3f, recalibration unsafe",
                            quality.getAccuracy(), calibrationConfig.getMinAccuracy())))
                    .build();
        }
        if (quality.getAccuracyTrend() < -calibrationConfig.getDegradationTolerance()) {
            return result.status(CalibrationStatus.DEFERRED)
                    .reasons(List.of(String.format("Accuracy trending down (%.3f), waiting for it to settle",
                            quality.getAccuracyTrend())))
                    .build();
        }

        WindowStats stats = WindowStats.of(window);
        List<String> reasons = new ArrayList<>();

        // Cut points are published unrounded so that no move exceeds the step
        double step = calibrationConfig.getMaxThresholdStep();
        double reject = current.getAutoReject()
                + clampStep(proposeReject(current.getAutoReject(), stats, reasons) - current.getAutoReject(), step);
        double approve = current.getAutoApprove()
                + clampStep(proposeApprove(current.getAutoApprove(), stats, reasons) - current.getAutoApprove(), step);
        // a relaxed auto-approve may not drop below the auto-reject it is paired with
        approve = Math.max(reject, approve);
        double review = Math.max(reject, Math.min(approve, current.getReviewRequired()));

        FactorWeights weights = proposeWeights(current.getWeights(), window, reasons);
        ThresholdConfig proposed;
        try {
            proposed = current.toBuilder()
                    .autoApprove(approve)
                    .reviewRequired(review)
                    .autoReject(reject)
                    .weights(weights)
                    .build();
        } catch (InvalidThresholdConfigException e) {
            log.warn("Calibration produced an invalid configuration: {}", e.getMessage());
            List<String> rejection = new ArrayList<>(reasons);
            rejection.add("Proposed configuration is invalid: " + e.getMessage());
            return result.status(CalibrationStatus.REJECTED).reasons(List.copyOf(rejection)).build();
        }

        double approveDelta = round(approve - current.getAutoApprove());
        double rejectDelta = round(reject - current.getAutoReject());
        double reviewDelta = round(review - current.getReviewRequired());

        result.proposed(proposed)
                .autoApproveDelta(approveDelta)
                .reviewRequiredDelta(reviewDelta)
                .autoRejectDelta(rejectDelta)
                .bias(detectBias(stats))
                .improvementPotential(round(estimateImprovement(approveDelta, rejectDelta, stats)));

        CalibrationAdjustment draft = result.reasons(List.copyOf(reasons)).build();
        if (!draft.hasChanges()) {
            return draft.toBuilder().status(CalibrationStatus.NO_CHANGE)
                    .reasons(List.of("Feedback supports the current thresholds"))
                    .build();
        }

        Replay before = replay(window, current);
        Replay after = replay(window, proposed);
        if (after.accuracy < before.accuracy - EPSILON || after.falsePositiveRate > before.falsePositiveRate + EPSILON) {
            List<String> rejection = new ArrayList<>(reasons);
            rejection.add(String.format("Replay under proposal: accuracy %.3f -> %.3f, fp %.3f -> %.3f",
                    before.accuracy, after.accuracy, before.falsePositiveRate, after.falsePositiveRate));
            return draft.toBuilder().status(CalibrationStatus.REJECTED).reasons(List.copyOf(rejection)).build();
        }
        return draft.toBuilder().status(CalibrationStatus.APPLIED).build();
    }

    private double proposeApprove(double current, WindowStats stats, List<String> reasons) {
        if (stats.falsePositiveRate > calibrationConfig.getFalsePositiveCeiling()
                && current < calibrationConfig.getApproveMax()) {
            reasons.add(String.format("False positive rate %.3f above %.3f, raising auto-approve",
                    stats.falsePositiveRate, calibrationConfig.getFalsePositiveCeiling()));
            return Math.min(calibrationConfig.getApproveMax(), current + calibrationConfig.getApproveStep());
        }
        if (stats.falsePositiveRate < calibrationConfig.getFalsePositiveFloor()
                && stats.accuracy > calibrationConfig.getHighAccuracy()
                && current > calibrationConfig.getApproveMin()) {
            reasons.add(String.format("False positive rate %.3f with accuracy %.3f, relaxing auto-approve",
                    stats.falsePositiveRate, stats.accuracy));
            return Math.max(calibrationConfig.getApproveMin(), current - calibrationConfig.getApproveRelaxStep());
        }
        return current;
    }

    private double proposeReject(double current, WindowStats stats, List<String> reasons) {
        if (stats.falseNegativeRate > calibrationConfig.getFalseNegativeCeiling()
                && current > calibrationConfig.getRejectMin()) {
            reasons.add(String.format("False negative rate %.3f above %.3f, lowering auto-reject",
                    stats.falseNegativeRate, calibrationConfig.getFalseNegativeCeiling()));
            return Math.max(calibrationConfig.getRejectMin(), current - calibrationConfig.getRejectStep());
        }
        return current;
    }

    /**
     * Factors that were strong on most correct verdicts gain weight, those rarely strong lose it.
     * Only feedback carrying a factor breakdown takes part.
     */
    FactorWeights proposeWeights(FactorWeights current, List<ValidationFeedback> window, List<String> reasons) {
        int correctWithFactors = 0;
        Map<ConfidenceFactor, Integer> strongCounts = new EnumMap<>(ConfidenceFactor.class);
        for (ValidationFeedback feedback : window) {
            ConfidenceFactors factors = feedback.getFactors();
            if (factors == null || !feedback.isCorrect()) {
                continue;
            }
            correctWithFactors++;
            for (ConfidenceFactor factor : ConfidenceFactor.values()) {
                if (factors.get(factor) >= calibrationConfig.getStrongFactorLevel()) {
                    strongCounts.merge(factor, 1, Integer::sum);
                }
            }
        }
        if (correctWithFactors < calibrationConfig.getMinSamples()) {
            return current;
        }

        boolean changed = false;
        Map<ConfidenceFactor, Double> raw = new EnumMap<>(ConfidenceFactor.class);
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            double strongRate = (double) strongCounts.getOrDefault(factor, 0) / correctWithFactors;
            double weight = current.get(factor);
            if (strongRate > calibrationConfig.getBoostAbove()) {
                weight *= 1.0 + calibrationConfig.getWeightStepPct();
                changed = true;
            } else if (strongRate < calibrationConfig.getReduceBelow()) {
                weight *= 1.0 - calibrationConfig.getWeightStepPct();
                changed = true;
            }
            raw.put(factor, weight);
        }
        if (!changed) {
            return current;
        }
        FactorWeights proposed = FactorWeights.normalized(raw);
        if (proposed.equals(current)) {
            return current;
        }
        reasons.add("Factor weights rebalanced from correct-verdict factor strength");
        return proposed;
    }

    BiasReport detectBias(WindowStats stats) {
        double bias = stats.meanPredictedConfidence - stats.humanApprovalRate;
        BiasDirection direction = BiasDirection.NONE;
        if (bias > calibrationConfig.getBiasLimit()) {
            direction = BiasDirection.OVERCONFIDENT;
        } else if (bias < -calibrationConfig.getBiasLimit()) {
            direction = BiasDirection.UNDERCONFIDENT;
        }
        return BiasReport.builder()
                .detected(direction != BiasDirection.NONE)
                .direction(direction)
                .meanPredictedConfidence(round(stats.meanPredictedConfidence))
                .humanApprovalRate(round(stats.humanApprovalRate))
                .bias(round(bias))
                .build();
    }

    private double estimateImprovement(double approveDelta, double rejectDelta, WindowStats stats) {
        double estimate = 0.0;
        if (approveDelta > 0) {
            estimate += approveDelta * stats.falsePositiveRate;
        }
        if (rejectDelta < 0) {
            estimate += -rejectDelta * stats.falseNegativeRate;
        }
        return Math.min(calibrationConfig.getMaxImprovement(), Math.max(0.0, estimate));
    }

    /**
     * Re-decide every feedback item under {@code config} and score the verdicts against the human ones.
     * Items with a factor breakdown are re-scored with the config's weights.
     */
    Replay replay(List<ValidationFeedback> window, ThresholdConfig config) {
        int correct = 0;
        int falsePositives = 0;
        for (ValidationFeedback feedback : window) {
            double confidence = feedback.getFactors() != null
                    ? rescore(feedback.getFactors(), config.getWeights())
                    : feedback.getPredictedConfidence();
            ValidationOutcome outcome = decisionEngine.classify(confidence, config);
            boolean approved = feedback.getActualDecision() == HumanDecision.APPROVED;
            if (outcome == ValidationOutcome.AUTO_APPROVE) {
                if (approved) correct++;
                else falsePositives++;
            } else if (outcome == ValidationOutcome.AUTO_REJECT) {
                if (!approved) correct++;
            } else {
                correct++;
            }
        }
        int n = Math.max(1, window.size());
        return new Replay((double) correct / n, (double) falsePositives / n);
    }

    private static double rescore(ConfidenceFactors factors, FactorWeights weights) {
        double overall = 0.0;
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            overall += weights.get(factor) * factors.get(factor);
        }
        return Math.max(0.0, Math.min(1.0, overall));
    }

    private static double clampStep(double delta, double step) {
        return Math.max(-step, Math.min(step, delta));
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    static final class Replay {
        final double accuracy;
        final double falsePositiveRate;

        Replay(double accuracy, double falsePositiveRate) {
            this.accuracy = accuracy;
            this.falsePositiveRate = falsePositiveRate;
        }
    }

    static final class WindowStats {
        double accuracy;
        double falsePositiveRate;
        double falseNegativeRate;
        double meanPredictedConfidence;
        double humanApprovalRate;

        static WindowStats of(List<ValidationFeedback> window) {
            WindowStats stats = new WindowStats();
            int n = window.size();
            if (n == 0) {
                return stats;
            }
            int correct = 0, fp = 0, fn = 0, approved = 0;
            double confidenceSum = 0.0;
            for (ValidationFeedback feedback : window) {
                if (feedback.isCorrect()) correct++;
                if (feedback.isFalsePositive()) fp++;
                if (feedback.isFalseNegative()) fn++;
                if (feedback.getActualDecision() == HumanDecision.APPROVED) approved++;
                confidenceSum += feedback.getPredictedConfidence();
            }
            stats.accuracy = (double) correct / n;
            stats.falsePositiveRate = (double) fp / n;
            stats.falseNegativeRate = (double) fn / n;
            stats.meanPredictedConfidence = confidenceSum / n;
            stats.humanApprovalRate = (double) approved / n;
            return stats;
        }
    }
}
