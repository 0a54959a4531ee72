package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A memory record as delivered by the upstream extraction pipeline.
 * The four confidence signals arrive pre-computed; boxed so that a missing signal can be told apart from zero.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Emotionally-scored memory record produced by the extraction pipeline")
public class MemoryRecord {

    @Schema(description = "Record identifier", example = "MEM-000042")
    String id;

    @Schema(description = "Text content of the memory")
    String content;

    @Schema(description = "When the remembered exchange happened, epoch milliseconds", example = "1739886764000")
    long timestamp;

    @Schema(description = "Mood, trajectory and pattern outputs of the emotional analysis")
    EmotionalAnalysis emotionalAnalysis;

    @Schema(description = "Relationship-dynamics summary")
    RelationshipDynamics relationshipDynamics;

    @Schema(description = "Extraction confidence (0-1)", example = "0.9")
    Double extractionConfidence;

    @Schema(description = "Emotional coherence (0-1)", example = "0.85")
    Double emotionalCoherence;

    @Schema(description = "Relationship accuracy (0-1)", example = "0.8")
    Double relationshipAccuracy;

    @Schema(description = "Context quality (0-1)", example = "0.7")
    Double contextQuality;
}
