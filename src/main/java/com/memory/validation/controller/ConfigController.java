package com.memory.validation.controller;

import com.memory.validation.exception.InvalidThresholdConfigException;
import com.memory.validation.model.FactorWeights;
import com.memory.validation.model.ThresholdConfig;
import com.memory.validation.model.ThresholdVersion;
import com.memory.validation.service.CalibrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View, replace and roll back the versioned decision thresholds")
public class ConfigController {

    private final CalibrationService calibrationService;

    public ConfigController(CalibrationService calibrationService) {
        this.calibrationService = calibrationService;
    }

    // ── Thresholds ──

    @Operation(summary = "Get the active threshold version")
    @GetMapping("/thresholds")
    public ResponseEntity<ThresholdVersion> getThresholds() {
        return ResponseEntity.ok(calibrationService.current());
    }

    @Operation(summary = "Replace the decision thresholds",
            description = "Publishes a new threshold version. Omitted fields keep their current value. The result " +
                    "must satisfy 0 <= autoReject <= reviewRequired <= autoApprove <= 1 and weights summing to 1, " +
                    "otherwise nothing changes and 400 is returned.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        ThresholdConfig current = calibrationService.current().getConfig();
        FactorWeights weights = current.getWeights();
        try {
            Object rawWeights = body.get("weights");
            if (rawWeights instanceof Map<?, ?> w) {
                weights = new FactorWeights(
                        toDouble(w, "extractionConfidence", weights.getExtractionConfidence()),
                        toDouble(w, "emotionalCoherence", weights.getEmotionalCoherence()),
                        toDouble(w, "relationshipAccuracy", weights.getRelationshipAccuracy()),
                        toDouble(w, "contextQuality", weights.getContextQuality()));
            }
            ThresholdConfig replacement = new ThresholdConfig(
                    toDouble(body, "autoApprove", current.getAutoApprove()),
                    toDouble(body, "reviewRequired", current.getReviewRequired()),
                    toDouble(body, "autoReject", current.getAutoReject()),
                    weights);
            Object reason = body.get("reason");
            return ResponseEntity.ok(calibrationService.replaceConfig(replacement,
                    reason != null ? reason.toString() : null));
        } catch (InvalidThresholdConfigException e) {
            return badRequest(e.getMessage());
        }
    }

    @Operation(summary = "Roll back to the previous threshold version")
    @PostMapping("/thresholds/rollback")
    public ResponseEntity<?> rollback() {
        Optional<ThresholdVersion> restored = calibrationService.rollback();
        if (restored.isEmpty()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "No earlier threshold version to roll back to"));
        }
        return ResponseEntity.ok(restored.get());
    }

    @Operation(summary = "Get threshold version history", description = "Active version first.")
    @GetMapping("/thresholds/history")
    public ResponseEntity<List<ThresholdVersion>> getHistory() {
        return ResponseEntity.ok(calibrationService.history());
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error) {
        return ResponseEntity.badRequest().body(Map.of("error", error));
    }

    private double toDouble(Map<?, ?> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new InvalidThresholdConfigException(key + " is not a number: " + v);
        }
    }
}
