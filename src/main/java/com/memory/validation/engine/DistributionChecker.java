package com.memory.validation.engine;

import com.memory.validation.config.BatchConfig;
import com.memory.validation.model.DistributionCheck;
import com.memory.validation.model.ValidationOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Post-hoc sanity check of a batch's verdict mix. Advisory: it flags, it never fails a batch.
 *
 * The expected ratios are an operational target, not something the decision rule guarantees,
 * so only large deviations are flagged.
 */
@Component
public class DistributionChecker {

    private final BatchConfig batchConfig;

    public DistributionChecker(BatchConfig batchConfig) {
        this.batchConfig = batchConfig;
    }

    public DistributionCheck check(Map<ValidationOutcome, Integer> counts, int errorCount) {
        BatchConfig.DistributionCheck limits = batchConfig.getDistributionCheck();

        int decided = 0;
        for (int count : counts.values()) {
            decided += count;
        }
        int submitted = decided + errorCount;
        double errorRate = submitted > 0 ? (double) errorCount / submitted : 0.0;

        Map<ValidationOutcome, Double> ratios = new EnumMap<>(ValidationOutcome.class);
        for (ValidationOutcome outcome : ValidationOutcome.values()) {
            int count = counts.getOrDefault(outcome, 0);
            ratios.put(outcome, decided > 0 ? round((double) count / decided) : 0.0);
        }

        List<String> findings = new ArrayList<>();
        if (submitted > 0 && errorRate > limits.getMaxErrorRate()) {
            findings.add(String.format("Error rate %.3f exceeds %.3f", errorRate, limits.getMaxErrorRate()));
        }

        boolean evaluated = decided >= limits.getMinSampleSize();
        if (evaluated) {
            for (ValidationOutcome outcome : ValidationOutcome.values()) {
                double observed = ratios.get(outcome);
                double expected = expectedRatio(outcome, limits);
                if (Math.abs(observed - expected) > limits.getMaxDeviation()) {
                    findings.add(String.format("%s ratio %.3f deviates from expected %.3f by more than %.2f",
                            outcome, observed, expected, limits.getMaxDeviation()));
                }
                if (observed >= limits.getDegenerateRatio()) {
                    findings.add(String.format("Degenerate batch: %s makes up %.3f of decisions", outcome, observed));
                }
            }
        }

        return DistributionCheck.builder()
                .flagged(!findings.isEmpty())
                .evaluated(evaluated)
                .observedRatios(Collections.unmodifiableMap(ratios))
                .errorRate(round(errorRate))
                .findings(List.copyOf(findings))
                .build();
    }

    private static double expectedRatio(ValidationOutcome outcome, BatchConfig.DistributionCheck limits) {
        switch (outcome) {
            case AUTO_APPROVE: return limits.getExpectedApproveRatio();
            case AUTO_REJECT: return limits.getExpectedRejectRatio();
            default: return limits.getExpectedReviewRatio();
        }
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
