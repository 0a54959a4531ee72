package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "How well a sample covers the emotional, temporal, relationship and quality range")
public class CoverageAnalysis {

    EmotionalCoverage emotionalCoverage;
    TemporalCoverage temporalCoverage;
    RelationshipCoverage relationshipCoverage;
    QualityDistribution qualityDistribution;

    @Schema(description = "Weighted coverage score (0-1)", example = "0.78")
    double overallScore;

    @Value
    @Builder
    public static class EmotionalCoverage {
        List<String> represented;     // pattern types and trajectory directions seen
        double coveragePercentage;
        List<String> gaps;
    }

    @Value
    @Builder
    public static class TemporalCoverage {
        Long start;                   // epoch millis, null for an empty sample
        Long end;
        TemporalDistribution distribution;
        List<TimeGap> gaps;
    }

    @Value
    @Builder
    public static class TimeGap {
        long start;
        long end;
    }

    @Value
    @Builder
    public static class RelationshipCoverage {
        List<String> represented;     // SUPPORT/CONFLICT profiles, e.g. "HIGH/LOW"
        double coveragePercentage;
    }
}
