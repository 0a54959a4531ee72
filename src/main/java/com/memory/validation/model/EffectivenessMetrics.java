package com.memory.validation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "How much human effort automation saves over recent batches, and at what quality")
public class EffectivenessMetrics {

    @Schema(description = "Auto-approved share of processed records", example = "0.27")
    double autoApprovalRate;

    @Schema(description = "Share of processed records decided without a reviewer", example = "0.74")
    double humanWorkloadReduction;

    @Schema(description = "accuracy x (1 - mean error rate)", example = "0.91")
    double qualityMaintenance;

    @Schema(description = "Throughput against the per-minute target, capped at 1", example = "1.0")
    double timeEfficiency;

    @Schema(description = "Weighted effectiveness score", example = "0.68")
    double overallEffectiveness;

    int batchesConsidered;
}
