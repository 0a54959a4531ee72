package com.memory.validation.controller;

import com.memory.validation.model.AnalyticsReport;
import com.memory.validation.model.EffectivenessMetrics;
import com.memory.validation.model.SampledRecords;
import com.memory.validation.model.SamplingEffectiveness;
import com.memory.validation.model.SamplingRequest;
import com.memory.validation.model.SamplingStrategy;
import com.memory.validation.service.ValidationAnalyticsService;
import com.memory.validation.service.ValidationSamplingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Batch performance, system health, automation effectiveness and validation sampling")
public class AnalyticsController {

    private final ValidationAnalyticsService analyticsService;
    private final ValidationSamplingService samplingService;

    public AnalyticsController(ValidationAnalyticsService analyticsService,
                               ValidationSamplingService samplingService) {
        this.analyticsService = analyticsService;
        this.samplingService = samplingService;
    }

    @GetMapping("/report")
    @Operation(summary = "Get the analytics report",
               description = "Performance totals, recent batch trends, system health and recommendations")
    public ResponseEntity<AnalyticsReport> getReport() {
        return ResponseEntity.ok(analyticsService.report());
    }

    @GetMapping("/effectiveness")
    @Operation(summary = "Get automation effectiveness over the last 10 batches")
    public ResponseEntity<EffectivenessMetrics> getEffectiveness() {
        return ResponseEntity.ok(analyticsService.effectiveness());
    }

    @GetMapping("/sampling-effectiveness")
    @Operation(summary = "Get coverage and efficiency of recent validation samples")
    public ResponseEntity<SamplingEffectiveness> getSamplingEffectiveness() {
        return ResponseEntity.ok(analyticsService.samplingEffectiveness());
    }

    @PostMapping("/sample")
    @Operation(summary = "Draw a validation sample",
               description = "Stratified sample for human spot checks. Without a targetSize the strategy is " +
                       "recommended from the records; a seed makes the draw reproducible.")
    public ResponseEntity<?> sample(@RequestBody SamplingRequest request) {
        if (request.getRecords() == null || request.getRecords().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "records must be a non-empty list"));
        }
        SamplingStrategy strategy;
        if (request.getTargetSize() != null) {
            if (request.getTargetSize() <= 0) {
                return ResponseEntity.badRequest().body(Map.of("error", "targetSize must be > 0"));
            }
            strategy = samplingService.defaultStrategy(request.getTargetSize());
        } else {
            strategy = samplingService.recommendStrategy(request.getRecords());
        }
        if (request.getSeed() != null) {
            strategy = strategy.toBuilder().seed(request.getSeed()).build();
        }
        SampledRecords result = samplingService.sample(request.getRecords(), strategy);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/sample/strategy")
    @Operation(summary = "Recommend a sampling strategy for a set of records")
    public ResponseEntity<?> recommendStrategy(@RequestBody SamplingRequest request) {
        if (request.getRecords() == null || request.getRecords().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "records must be a non-empty list"));
        }
        return ResponseEntity.ok(samplingService.recommendStrategy(request.getRecords()));
    }
}
