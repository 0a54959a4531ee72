package com.memory.validation.engine;

import com.memory.validation.model.CoverageAnalysis;
import com.memory.validation.model.DynamicsLevel;
import com.memory.validation.model.EmotionalAnalysis;
import com.memory.validation.model.EmotionalPattern;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.PatternType;
import com.memory.validation.model.QualityDistribution;
import com.memory.validation.model.RelationshipDynamics;
import com.memory.validation.model.SupportLevel;
import com.memory.validation.model.TemporalDistribution;
import com.memory.validation.model.TrajectoryDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Scores how representative a sample of records is.
 *
 * Four dimensions are measured: which emotional markers appear, how evenly the timestamps spread,
 * which support/conflict profiles appear, and how the extraction-confidence bands are mixed.
 */
@Component
public class CoverageAnalyzer {

    static final long GAP_MILLIS = TimeUnit.DAYS.toMillis(7);

    // ── Overall score weights ──
    private static final double EMOTIONAL_WEIGHT = 0.30;
    private static final double TEMPORAL_WEIGHT = 0.25;
    private static final double RELATIONSHIP_WEIGHT = 0.25;
    private static final double QUALITY_WEIGHT = 0.20;

    // Ideal band mix of a validation sample
    private static final double IDEAL_HIGH = 0.2;
    private static final double IDEAL_MEDIUM = 0.6;
    private static final double IDEAL_LOW = 0.2;

    public static final List<String> EMOTIONAL_MARKERS = emotionalMarkerNames();
    static final int RELATIONSHIP_PROFILES = SupportLevel.values().length * DynamicsLevel.values().length;

    public CoverageAnalysis analyze(List<MemoryRecord> samples) {
        List<MemoryRecord> records = new ArrayList<>();
        if (samples != null) {
            for (MemoryRecord record : samples) {
                if (record != null) {
                    records.add(record);
                }
            }
        }

        CoverageAnalysis.EmotionalCoverage emotional = emotionalCoverage(records);
        CoverageAnalysis.TemporalCoverage temporal = temporalCoverage(records);
        CoverageAnalysis.RelationshipCoverage relationship = relationshipCoverage(records);
        QualityDistribution quality = qualityDistribution(records);

        double overall = EMOTIONAL_WEIGHT * emotional.getCoveragePercentage() / 100.0
                + TEMPORAL_WEIGHT * temporalScore(temporal)
                + RELATIONSHIP_WEIGHT * relationship.getCoveragePercentage() / 100.0
                + QUALITY_WEIGHT * qualityScore(quality);

        return CoverageAnalysis.builder()
                .emotionalCoverage(emotional)
                .temporalCoverage(temporal)
                .relationshipCoverage(relationship)
                .qualityDistribution(quality)
                .overallScore(round(overall))
                .build();
    }

    /**
     * Pattern types and trajectory direction of one record, as marker names.
     */
    public static Set<String> emotionalMarkers(MemoryRecord record) {
        Set<String> markers = new LinkedHashSet<>();
        EmotionalAnalysis analysis = record != null ? record.getEmotionalAnalysis() : null;
        if (analysis == null) {
            return markers;
        }
        if (analysis.getTrajectory() != null) {
            markers.add(analysis.getTrajectory().name());
        }
        if (analysis.getPatterns() != null) {
            for (EmotionalPattern pattern : analysis.getPatterns()) {
                if (pattern != null && pattern.getType() != null) {
                    markers.add(pattern.getType().name());
                }
            }
        }
        return markers;
    }

    /**
     * high (&ge; 0.8), medium (&ge; 0.5) or low, from extraction confidence. Missing counts as 0.5.
     */
    public static String qualityBand(MemoryRecord record) {
        Double confidence = record != null ? record.getExtractionConfidence() : null;
        return qualityBand(confidence != null ? confidence : 0.5);
    }

    public static String qualityBand(double confidence) {
        if (confidence >= 0.8) {
            return "high";
        }
        return confidence >= 0.5 ? "medium" : "low";
    }

    // ── Dimensions ──

    CoverageAnalysis.EmotionalCoverage emotionalCoverage(List<MemoryRecord> records) {
        Set<String> found = new TreeSet<>();
        for (MemoryRecord record : records) {
            found.addAll(emotionalMarkers(record));
        }
        List<String> gaps = new ArrayList<>();
        for (String marker : EMOTIONAL_MARKERS) {
            if (!found.contains(marker)) {
                gaps.add(marker);
            }
        }
        return CoverageAnalysis.EmotionalCoverage.builder()
                .represented(List.copyOf(found))
                .coveragePercentage(round(100.0 * found.size() / EMOTIONAL_MARKERS.size()))
                .gaps(List.copyOf(gaps))
                .build();
    }

    CoverageAnalysis.TemporalCoverage temporalCoverage(List<MemoryRecord> records) {
        if (records.isEmpty()) {
            return CoverageAnalysis.TemporalCoverage.builder()
                    .distribution(TemporalDistribution.SPARSE)
                    .gaps(Collections.emptyList())
                    .build();
        }
        long[] timestamps = new long[records.size()];
        for (int i = 0; i < records.size(); i++) {
            timestamps[i] = records.get(i).getTimestamp();
        }
        Arrays.sort(timestamps);

        List<CoverageAnalysis.TimeGap> gaps = new ArrayList<>();
        for (int i = 1; i < timestamps.length; i++) {
            if (timestamps[i] - timestamps[i - 1] > GAP_MILLIS) {
                gaps.add(CoverageAnalysis.TimeGap.builder().start(timestamps[i - 1]).end(timestamps[i]).build());
            }
        }

        return CoverageAnalysis.TemporalCoverage.builder()
                .start(timestamps[0])
                .end(timestamps[timestamps.length - 1])
                .distribution(distribution(timestamps))
                .gaps(List.copyOf(gaps))
                .build();
    }

    /**
     * Classifies sorted timestamps by the coefficient of variation of their intervals.
     * Records all sharing one instant count as clustered.
     */
    static TemporalDistribution distribution(long[] sorted) {
        if (sorted.length <= 2) {
            return TemporalDistribution.SPARSE;
        }
        int intervals = sorted.length - 1;
        double mean = (double) (sorted[sorted.length - 1] - sorted[0]) / intervals;
        if (mean == 0.0) {
            return TemporalDistribution.CLUSTERED;
        }
        double sumSquares = 0.0;
        for (int i = 1; i < sorted.length; i++) {
            double diff = (sorted[i] - sorted[i - 1]) - mean;
            sumSquares += diff * diff;
        }
        double cv = Math.sqrt(sumSquares / intervals) / mean;
        if (cv < 0.5) {
            return TemporalDistribution.EVEN;
        }
        return cv > 2.0 ? TemporalDistribution.CLUSTERED : TemporalDistribution.SPARSE;
    }

    CoverageAnalysis.RelationshipCoverage relationshipCoverage(List<MemoryRecord> records) {
        Set<String> profiles = new TreeSet<>();
        for (MemoryRecord record : records) {
            RelationshipDynamics dynamics = record.getRelationshipDynamics();
            if (dynamics == null || dynamics.getSupportLevel() == null || dynamics.getConflictLevel() == null) {
                continue;
            }
            profiles.add(dynamics.getSupportLevel().name() + "/" + dynamics.getConflictLevel().name());
        }
        return CoverageAnalysis.RelationshipCoverage.builder()
                .represented(List.copyOf(profiles))
                .coveragePercentage(round(100.0 * profiles.size() / RELATIONSHIP_PROFILES))
                .build();
    }

    QualityDistribution qualityDistribution(List<MemoryRecord> records) {
        int high = 0;
        int medium = 0;
        int low = 0;
        for (MemoryRecord record : records) {
            switch (qualityBand(record)) {
                case "high": high++; break;
                case "medium": medium++; break;
                default: low++;
            }
        }
        return QualityDistribution.builder().high(high).medium(medium).low(low).build();
    }

    // ── Scores ──

    static double temporalScore(CoverageAnalysis.TemporalCoverage temporal) {
        double score = 0.5;
        if (temporal.getDistribution() == TemporalDistribution.EVEN) {
            score += 0.3;
        } else if (temporal.getDistribution() == TemporalDistribution.SPARSE) {
            score += 0.1;
        }
        score -= Math.min(0.3, temporal.getGaps().size() * 0.1);
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double qualityScore(QualityDistribution quality) {
        int total = quality.total();
        if (total == 0) {
            return 0.0;
        }
        double distance = Math.abs((double) quality.getHigh() / total - IDEAL_HIGH)
                + Math.abs((double) quality.getMedium() / total - IDEAL_MEDIUM)
                + Math.abs((double) quality.getLow() / total - IDEAL_LOW);
        return Math.max(0.0, 1.0 - distance);
    }

    private static List<String> emotionalMarkerNames() {
        List<String> names = new ArrayList<>();
        for (PatternType type : PatternType.values()) {
            names.add(type.name());
        }
        for (TrajectoryDirection direction : TrajectoryDirection.values()) {
            names.add(direction.name());
        }
        return List.copyOf(names);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
