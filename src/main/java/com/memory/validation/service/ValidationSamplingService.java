package com.memory.validation.service;

import com.memory.validation.config.MetricsConfig;
import com.memory.validation.config.SamplingConfig;
import com.memory.validation.engine.CoverageAnalyzer;
import com.memory.validation.model.CoverageAnalysis;
import com.memory.validation.model.EmotionalAnalysis;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.RelationshipDynamics;
import com.memory.validation.model.SampledRecords;
import com.memory.validation.model.SamplingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Picks records for human spot-check validation.
 *
 * Stratified draws allocate the target proportionally to each stratum and top up from the rest of the
 * population. Every shuffle runs off one seeded {@link Random}, so a seed reproduces its sample.
 */
@Service
public class ValidationSamplingService {

    private static final Logger log = LoggerFactory.getLogger(ValidationSamplingService.class);

    static final String SIMPLE_RANDOM = "simple-random";
    static final String BALANCED_STRATIFIED = "balanced-stratified";
    static final String DEFAULT_STRATEGY = "balanced-stratified-sampling";

    private static final long ONE_YEAR_MILLIS = TimeUnit.DAYS.toMillis(365);

    private final CoverageAnalyzer coverageAnalyzer;
    private final ValidationAnalyticsService analyticsService;
    private final SamplingConfig samplingConfig;
    private final MetricsConfig metricsConfig;

    public ValidationSamplingService(CoverageAnalyzer coverageAnalyzer,
                                     ValidationAnalyticsService analyticsService,
                                     SamplingConfig samplingConfig,
                                     MetricsConfig metricsConfig) {
        this.coverageAnalyzer = coverageAnalyzer;
        this.analyticsService = analyticsService;
        this.samplingConfig = samplingConfig;
        this.metricsConfig = metricsConfig;
    }

    public SampledRecords sample(List<MemoryRecord> records, SamplingStrategy strategy) {
        List<MemoryRecord> population = nonNull(records);
        long seed = resolveSeed(strategy.getSeed());
        int target = Math.min(Math.max(0, strategy.getTargetSize()), population.size());
        Random random = new Random(seed);

        List<MemoryRecord> picked = strategy.isStratified()
                ? stratifiedSample(population, strategy, target, random)
                : randomSample(population, target, random);
        CoverageAnalysis coverage = coverageAnalyzer.analyze(picked);

        SampledRecords result = SampledRecords.builder()
                .samples(Collections.unmodifiableList(picked))
                .coverage(coverage)
                .populationSize(population.size())
                .sampleSize(picked.size())
                .samplingRate(population.isEmpty() ? 0.0
                        : Math.round((double) picked.size() / population.size() * 1000.0) / 1000.0)
                .strategy(strategy.getName())
                .seed(seed)
                .sampledAt(System.currentTimeMillis())
                .build();

        warnOnLowCoverage(result.getSampleSize(), coverage);
        metricsConfig.recordSample(strategy.getName(), picked.size(), coverage.getOverallScore());
        analyticsService.recordSampling(result);
        log.info("Sampled {} of {} records with {} (seed {}), coverage {}",
                picked.size(), population.size(), strategy.getName(), seed, coverage.getOverallScore());
        return result;
    }

    /**
     * Recommends a strategy from the size, emotional diversity and time span of the records.
     */
    public SamplingStrategy recommendStrategy(List<MemoryRecord> records) {
        List<MemoryRecord> population = nonNull(records);
        int size = population.size();
        SamplingStrategy strategy;

        if (size < 100) {
            strategy = SamplingStrategy.builder()
                    .name(SIMPLE_RANDOM)
                    .targetSize(Math.min(50, size))
                    .expectedCoverage(0.7)
                    .build();
        } else if (emotionalDiversity(population) > 0.7 && temporalSpread(population) > 0.7) {
            strategy = SamplingStrategy.builder()
                    .name(BALANCED_STRATIFIED)
                    .targetSize(Math.min(200, size / 10))
                    .byEmotion(true)
                    .byTimePeriod(true)
                    .byQuality(true)
                    .expectedCoverage(0.85)
                    .build();
        } else {
            strategy = defaultStrategy(Math.min(150, size / 10));
        }
        log.debug("Recommended {} for {} records (target {})", strategy.getName(), size, strategy.getTargetSize());
        return strategy;
    }

    public SamplingStrategy defaultStrategy(int targetSize) {
        return SamplingStrategy.builder()
                .name(DEFAULT_STRATEGY)
                .targetSize(targetSize)
                .byEmotion(true)
                .byTimePeriod(true)
                .byRelationship(true)
                .byQuality(true)
                .expectedCoverage(0.85)
                .build();
    }

    public SamplingStrategy defaultStrategy() {
        return defaultStrategy(samplingConfig.getDefaultTargetSize());
    }

    /**
     * Re-analyses an existing sample, warning when it falls below the configured coverage.
     */
    public CoverageAnalysis ensureCoverage(SampledRecords sample) {
        CoverageAnalysis coverage = coverageAnalyzer.analyze(sample.getSamples());
        warnOnLowCoverage(sample.getSampleSize(), coverage);
        return coverage;
    }

    // ── Drawing ──

    List<MemoryRecord> stratifiedSample(List<MemoryRecord> population, SamplingStrategy strategy,
                                        int target, Random random) {
        Map<String, List<MemoryRecord>> strata = new LinkedHashMap<>();
        for (MemoryRecord record : population) {
            strata.computeIfAbsent(stratumKey(record, strategy), k -> new ArrayList<>()).add(record);
        }

        List<MemoryRecord> picked = new ArrayList<>(target);
        for (List<MemoryRecord> members : strata.values()) {
            int share = (int) Math.round((double) members.size() / population.size() * target);
            if (share > 0) {
                picked.addAll(randomSample(members, share, random));
            }
        }

        if (picked.size() < target) {
            Set<MemoryRecord> used = Collections.newSetFromMap(new IdentityHashMap<>());
            used.addAll(picked);
            List<MemoryRecord> rest = new ArrayList<>();
            for (MemoryRecord record : population) {
                if (!used.contains(record)) {
                    rest.add(record);
                }
            }
            picked.addAll(randomSample(rest, target - picked.size(), random));
        }
        return picked.size() > target ? new ArrayList<>(picked.subList(0, target)) : picked;
    }

    static List<MemoryRecord> randomSample(List<MemoryRecord> members, int size, Random random) {
        List<MemoryRecord> copy = new ArrayList<>(members);
        if (size >= copy.size()) {
            return copy;
        }
        Collections.shuffle(copy, random);
        return new ArrayList<>(copy.subList(0, size));
    }

    static String stratumKey(MemoryRecord record, SamplingStrategy strategy) {
        List<String> parts = new ArrayList<>(4);
        if (strategy.isByEmotion()) {
            EmotionalAnalysis analysis = record.getEmotionalAnalysis();
            parts.add("emotion:" + (analysis != null && analysis.getTrajectory() != null
                    ? analysis.getTrajectory().name() : "unknown"));
        }
        if (strategy.isByTimePeriod()) {
            parts.add("time:" + YearMonth.from(Instant.ofEpochMilli(record.getTimestamp()).atZone(ZoneOffset.UTC)));
        }
        if (strategy.isByRelationship()) {
            RelationshipDynamics dynamics = record.getRelationshipDynamics();
            parts.add("relationship:" + (dynamics != null && dynamics.getSupportLevel() != null
                    ? dynamics.getSupportLevel().name() : "unknown"));
        }
        if (strategy.isByQuality()) {
            parts.add("quality:" + CoverageAnalyzer.qualityBand(record));
        }
        return parts.isEmpty() ? "default" : String.join("|", parts);
    }

    // ── Dataset characteristics ──

    static double emotionalDiversity(List<MemoryRecord> records) {
        Set<String> markers = new HashSet<>();
        for (MemoryRecord record : records) {
            markers.addAll(CoverageAnalyzer.emotionalMarkers(record));
        }
        return (double) markers.size() / CoverageAnalyzer.EMOTIONAL_MARKERS.size();
    }

    static double temporalSpread(List<MemoryRecord> records) {
        if (records.size() <= 1) {
            return 0.0;
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (MemoryRecord record : records) {
            min = Math.min(min, record.getTimestamp());
            max = Math.max(max, record.getTimestamp());
        }
        return Math.min(1.0, (double) (max - min) / ONE_YEAR_MILLIS);
    }

    private long resolveSeed(Long requested) {
        if (requested != null) {
            return requested;
        }
        if (samplingConfig.getSeed() != null) {
            return samplingConfig.getSeed();
        }
        return ThreadLocalRandom.current().nextLong();
    }

    private void warnOnLowCoverage(int sampleSize, CoverageAnalysis coverage) {
        if (sampleSize > 0 && coverage.getOverallScore() < samplingConfig.getMinCoverage()) {
            log.warn("Sample coverage {} below {}: emotional gaps {}, {} temporal gaps, relationship coverage {}%",
                    coverage.getOverallScore(), samplingConfig.getMinCoverage(),
                    coverage.getEmotionalCoverage().getGaps(), coverage.getTemporalCoverage().getGaps().size(),
                    coverage.getRelationshipCoverage().getCoveragePercentage());
        }
    }

    private static List<MemoryRecord> nonNull(List<MemoryRecord> records) {
        List<MemoryRecord> population = new ArrayList<>();
        if (records != null) {
            for (MemoryRecord record : records) {
                if (record != null) {
                    population.add(record);
                }
            }
        }
        return population;
    }
}
