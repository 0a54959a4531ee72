package com.memory.validation.engine;

import com.memory.validation.config.BatchConfig;
import com.memory.validation.model.DistributionCheck;
import com.memory.validation.model.ValidationOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DistributionCheckerTest {

    private DistributionChecker checker;

    @BeforeEach
    void setUp() {
        checker = new DistributionChecker(new BatchConfig());
    }

    @Test
    void check_expectedMix_notFlagged() {
        DistributionCheck check = checker.check(counts(25, 25, 50), 0);

        assertThat(check.isEvaluated()).isTrue();
        assertThat(check.isFlagged()).isFalse();
        assertThat(check.getObservedRatios().get(ValidationOutcome.AUTO_REJECT)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void check_smallBatch_ratiosNotJudged() {
        DistributionCheck check = checker.check(counts(10, 0, 0), 0);

        assertThat(check.isEvaluated()).isFalse();
        assertThat(check.isFlagged()).isFalse();
    }

    @Test
    void check_degenerateBatch_flagged() {
        DistributionCheck check = checker.check(counts(100, 0, 0), 0);

        assertThat(check.isFlagged()).isTrue();
        assertThat(check.getFindings())
                .anyMatch(f -> f.startsWith("Degenerate batch"))
                .anyMatch(f -> f.startsWith("AUTO_APPROVE ratio"));
    }

    @Test
    void check_highErrorRate_flagged() {
        DistributionCheck check = checker.check(counts(8, 7, 15), 20);

        assertThat(check.getErrorRate()).isCloseTo(0.4, within(1e-9));
        assertThat(check.isFlagged()).isTrue();
        assertThat(check.getFindings()).anyMatch(f -> f.startsWith("Error rate"));
    }

    @Test
    void check_configuredExpectations_used() {
        BatchConfig config = new BatchConfig();
        config.getDistributionCheck().setExpectedApproveRatio(0.9);
        config.getDistributionCheck().setExpectedReviewRatio(0.05);
        config.getDistributionCheck().setExpectedRejectRatio(0.05);
        DistributionChecker custom = new DistributionChecker(config);

        assertThat(custom.check(counts(90, 5, 5), 0).isFlagged()).isFalse();
        assertThat(custom.check(counts(25, 25, 50), 0).isFlagged()).isTrue();
    }

    private static Map<ValidationOutcome, Integer> counts(int approve, int review, int reject) {
        Map<ValidationOutcome, Integer> counts = new EnumMap<>(ValidationOutcome.class);
        counts.put(ValidationOutcome.AUTO_APPROVE, approve);
        counts.put(ValidationOutcome.REVIEW_REQUIRED, review);
        counts.put(ValidationOutcome.AUTO_REJECT, reject);
        return counts;
    }
}
