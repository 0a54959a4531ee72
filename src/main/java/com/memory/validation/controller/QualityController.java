package com.memory.validation.controller;

import com.memory.validation.model.CalibrationAdjustment;
import com.memory.validation.model.QualityAlert;
import com.memory.validation.model.QualityMetrics;
import com.memory.validation.service.CalibrationService;
import com.memory.validation.service.QualityMonitorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/quality")
@Tag(name = "Quality", description = "Accuracy metrics, quality alerts and threshold calibration")
public class QualityController {

    private final QualityMonitorService qualityMonitorService;
    private final CalibrationService calibrationService;

    public QualityController(QualityMonitorService qualityMonitorService,
                             CalibrationService calibrationService) {
        this.qualityMonitorService = qualityMonitorService;
        this.calibrationService = calibrationService;
    }

    @Operation(summary = "Get the latest quality metrics",
            description = "Pass refresh=true to recompute from the current feedback window first.")
    @GetMapping("/metrics")
    public ResponseEntity<QualityMetrics> getMetrics(@RequestParam(defaultValue = "false") boolean refresh) {
        if (refresh) {
            return ResponseEntity.ok(qualityMonitorService.refresh());
        }
        return ResponseEntity.ok(qualityMonitorService.latest());
    }

    @Operation(summary = "Get active quality alerts")
    @GetMapping("/alerts")
    public ResponseEntity<List<QualityAlert>> getAlerts() {
        return ResponseEntity.ok(qualityMonitorService.alerts());
    }

    @Operation(summary = "Propose a calibration without applying it")
    @PostMapping("/calibration/propose")
    public ResponseEntity<CalibrationAdjustment> propose() {
        return ResponseEntity.ok(calibrationService.propose());
    }

    @Operation(summary = "Run a calibration cycle now",
            description = "Applies the proposal when the replay gate passes; otherwise reports why not.")
    @PostMapping("/calibration/run")
    public ResponseEntity<CalibrationAdjustment> runCalibration() {
        return ResponseEntity.ok(calibrationService.runCycle());
    }
}
