package com.memory.validation.engine;

import com.memory.validation.exception.MalformedRecordException;
import com.memory.validation.model.ConfidenceFactor;
import com.memory.validation.model.ConfidenceFactors;
import com.memory.validation.model.ConfidenceResult;
import com.memory.validation.model.FactorWeights;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines the four per-record confidence signals into a single overall confidence.
 *
 * overall = wE·extraction + wC·coherence + wR·relationship + wX·context, clipped to [0, 1].
 * Weights travel with the ThresholdConfig so that calibration can revise them.
 * Stateless and deterministic: the same factors and config always yield the same result.
 */
@Component
public class ConfidenceScorer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    static final double WEAK_FACTOR_LIMIT = 0.5;

    /**
     * Read and clip the four signals of a record.
     *
     * @throws MalformedRecordException when a signal is missing, NaN or infinite
     */
    public ConfidenceFactors extractFactors(MemoryRecord record) {
        if (record == null) {
            throw new MalformedRecordException(null, "Record is null");
        }
        String id = record.getId();
        if (id == null || id.isBlank()) {
            throw new MalformedRecordException(id, "Record id is missing");
        }
        return ConfidenceFactors.builder()
                .extractionConfidence(signal(id, ConfidenceFactor.EXTRACTION_CONFIDENCE, record.getExtractionConfidence()))
                .emotionalCoherence(signal(id, ConfidenceFactor.EMOTIONAL_COHERENCE, record.getEmotionalCoherence()))
                .relationshipAccuracy(signal(id, ConfidenceFactor.RELATIONSHIP_ACCURACY, record.getRelationshipAccuracy()))
                .contextQuality(signal(id, ConfidenceFactor.CONTEXT_QUALITY, record.getContextQuality()))
                .build();
    }

    public ConfidenceResult score(ConfidenceFactors factors, ThresholdConfig config) {
        FactorWeights weights = config.getWeights();
        double overall = 0.0;
        for (ConfidenceFactor factor : ConfidenceFactor.values()) {
            overall += weights.get(factor) * factors.get(factor);
        }
        overall = clip(overall);

        // Weak factors hidden behind an otherwise passing score
        List<ConfidenceFactor> uncertain = new ArrayList<>();
        if (overall > config.getReviewRequired()) {
            for (ConfidenceFactor factor : ConfidenceFactor.values()) {
                if (factors.get(factor) < WEAK_FACTOR_LIMIT) {
                    uncertain.add(factor);
                }
            }
        }

        return ConfidenceResult.builder()
                .overall(overall)
                .factors(factors)
                .uncertaintyAreas(List.copyOf(uncertain))
                .build();
    }

    public ConfidenceResult score(MemoryRecord record, ThresholdConfig config) {
        return score(extractFactors(record), config);
    }

    private double signal(String recordId, ConfidenceFactor factor, Double value) {
        if (value == null) {
            throw new MalformedRecordException(recordId, factor.getFieldName() + " is missing");
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new MalformedRecordException(recordId, factor.getFieldName() + " is not a finite number: " + value);
        }
        if (value < 0.0 || value > 1.0) {
            log.debug("Clipping {}={} for record {} into [0, 1]", factor.getFieldName(), value, recordId);
        }
        return clip(value);
    }

    static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
