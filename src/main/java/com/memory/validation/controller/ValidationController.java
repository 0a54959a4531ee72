package com.memory.validation.controller;

import com.memory.validation.config.BatchConfig;
import com.memory.validation.exception.MalformedRecordException;
import com.memory.validation.model.BatchRequest;
import com.memory.validation.model.BatchResult;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.RecordEvaluation;
import com.memory.validation.model.ReviewQueueEntry;
import com.memory.validation.service.BatchValidationService;
import com.memory.validation.service.RecordEvaluationService;
import com.memory.validation.service.ReviewQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/validation")
@Tag(name = "Validation", description = "Evaluate memory records singly or in batches and read the human review queue")
public class ValidationController {

    private final RecordEvaluationService recordEvaluationService;
    private final BatchValidationService batchValidationService;
    private final ReviewQueueService reviewQueueService;
    private final BatchConfig batchConfig;

    public ValidationController(RecordEvaluationService recordEvaluationService,
                                BatchValidationService batchValidationService,
                                ReviewQueueService reviewQueueService,
                                BatchConfig batchConfig) {
        this.recordEvaluationService = recordEvaluationService;
        this.batchValidationService = batchValidationService;
        this.reviewQueueService = reviewQueueService;
        this.batchConfig = batchConfig;
    }

    @Operation(summary = "Evaluate a single memory record",
            description = "Scores confidence and significance, applies the significance-narrowed thresholds and " +
                    "returns the verdict (AUTO_APPROVE / REVIEW_REQUIRED / AUTO_REJECT) with priority and reasoning.")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody MemoryRecord record) {
        try {
            RecordEvaluation evaluation = recordEvaluationService.evaluate(record);
            return ResponseEntity.ok(evaluation);
        } catch (MalformedRecordException e) {
            Map<String, Object> body = new HashMap<>();
            body.put("error", e.getMessage());
            body.put("recordId", e.getRecordId());
            return ResponseEntity.badRequest().body(body);
        }
    }

    @Operation(summary = "Validate a batch of memory records",
            description = "Evaluates records concurrently against one threshold snapshot. Malformed records are " +
                    "reported as errors and never fail the batch.")
    @PostMapping("/batch")
    public ResponseEntity<?> processBatch(@RequestBody BatchRequest request) {
        if (request.getRecords() == null || request.getRecords().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "records must be a non-empty list"));
        }
        int target = request.getTargetThroughput() != null
                ? request.getTargetThroughput() : batchConfig.getDefaultTargetThroughput();
        if (target <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "targetThroughput must be > 0"));
        }
        BatchResult result = batchValidationService.process(request.getRecords(), target);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get the review queue",
            description = "Pending decisions ordered for human review: CRITICAL first by urgency, then HIGH and the " +
                    "rest by blended significance and recency.")
    @GetMapping("/review-queue")
    public ResponseEntity<List<ReviewQueueEntry>> getReviewQueue(
            @Parameter(description = "Maximum entries to return") @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(reviewQueueService.page(limit));
    }
}
