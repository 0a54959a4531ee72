package com.memory.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "validation.calibration")
public class CalibrationConfig {
    private boolean enabled = true;
    private int intervalHours = 6;
    private int windowSize = 1000;
    private int minSamples = 50;
    private double maxThresholdStep = 0.05;              // per cycle, per threshold
    private double minAccuracy = 0.70;                   // below this, recalibrating is unsafe
    private double degradationTolerance = 0.02;          // accuracy drop tolerated between refreshes

    // Proposal rules
    private double falsePositiveCeiling = 0.05;
    private double falsePositiveFloor = 0.02;
    private double highAccuracy = 0.90;
    private double falseNegativeCeiling = 0.05;
    private double approveStep = 0.05;
    private double approveRelaxStep = 0.02;
    private double rejectStep = 0.05;
    private double approveMax = 0.95;
    private double approveMin = 0.65;
    private double rejectMin = 0.30;

    // Weight tuning
    private double strongFactorLevel = 0.7;
    private double boostAbove = 0.8;
    private double reduceBelow = 0.5;
    private double weightStepPct = 0.10;

    private double biasLimit = 0.10;
    private double maxImprovement = 0.10;
}
