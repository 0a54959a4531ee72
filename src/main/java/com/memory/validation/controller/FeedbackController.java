package com.memory.validation.controller;

import com.memory.validation.model.ValidationFeedback;
import com.memory.validation.service.FeedbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/feedback")
@Tag(name = "Feedback", description = "Human verdicts on records the engine already decided")
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    @Operation(summary = "Submit reviewer feedback",
            description = "Records the human verdict for a record and removes it from the review queue.")
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody ValidationFeedback feedback) {
        try {
            return ResponseEntity.ok(feedbackService.submit(feedback));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
