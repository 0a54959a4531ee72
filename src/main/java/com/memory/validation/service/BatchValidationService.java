package com.memory.validation.service;

import com.memory.validation.concurrent.BatchCancellation;
import com.memory.validation.config.BatchConfig;
import com.memory.validation.config.MetricsConfig;
import com.memory.validation.engine.DistributionChecker;
import com.memory.validation.exception.MalformedRecordException;
import com.memory.validation.model.BatchError;
import com.memory.validation.model.BatchResult;
import com.memory.validation.model.DistributionCheck;
import com.memory.validation.model.EvaluationOutcome;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.ThresholdVersion;
import com.memory.validation.model.ValidationDecision;
import com.memory.validation.model.ValidationOutcome;
import com.memory.validation.repository.ThresholdStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Validates a batch of records concurrently.
 *
 * One threshold snapshot is taken at batch start. A semaphore sized to the batch's worker count
 * bounds in-flight evaluations on the shared executor; the dispatcher only waits for a free slot
 * and for the final join. Each record ends up as exactly one decision or one error.
 */
@Service
public class BatchValidationService {

    private static final Logger log = LoggerFactory.getLogger(BatchValidationService.class);

    static final String MDC_BATCH_ID = "batchId";

    private final RecordEvaluationService recordEvaluationService;
    private final ThresholdStore thresholdStore;
    private final DistributionChecker distributionChecker;
    private final QualityMonitorService qualityMonitorService;
    private final BatchConfig batchConfig;
    private final ExecutorService batchExecutor;
    private final MetricsConfig metricsConfig;
    private final ValidationAnalyticsService analyticsService;

    public BatchValidationService(RecordEvaluationService recordEvaluationService,
                                  ThresholdStore thresholdStore,
                                  DistributionChecker distributionChecker,
                                  QualityMonitorService qualityMonitorService,
                                  BatchConfig batchConfig,
                                  @Qualifier("batchExecutor") ExecutorService batchExecutor,
                                  MetricsConfig metricsConfig,
                                  ValidationAnalyticsService analyticsService) {
        this.recordEvaluationService = recordEvaluationService;
        this.thresholdStore = thresholdStore;
        this.distributionChecker = distributionChecker;
        this.qualityMonitorService = qualityMonitorService;
        this.batchConfig = batchConfig;
        this.batchExecutor = batchExecutor;
        this.metricsConfig = metricsConfig;
        this.analyticsService = analyticsService;
    }

    @Observed(name = "batch.process", contextualName = "process-batch")
    public BatchResult process(List<MemoryRecord> records, int targetThroughput) {
        return process(records, targetThroughput, BatchCancellation.none());
    }

    @Observed(name = "batch.process", contextualName = "process-batch")
    public BatchResult process(List<MemoryRecord> records, int targetThroughput, BatchCancellation cancellation) {
        String batchId = UUID.randomUUID().toString();
        MDC.put(MDC_BATCH_ID, batchId);
        try {
            return run(batchId, records == null ? Collections.emptyList() : records, targetThroughput, cancellation);
        } finally {
            MDC.remove(MDC_BATCH_ID);
        }
    }

    /**
     * ceil(target / perWorkerThroughput), kept within [1, maxWorkers].
     */
    int workerCount(int targetThroughput) {
        int perWorker = Math.max(1, batchConfig.getPerWorkerThroughput());
        int wanted = (int) Math.ceil(Math.max(0, targetThroughput) / (double) perWorker);
        return Math.max(1, Math.min(batchConfig.getMaxWorkers(), wanted));
    }

    private BatchResult run(String batchId, List<MemoryRecord> records, int targetThroughput,
                            BatchCancellation cancellation) {
        long start = System.currentTimeMillis();
        ThresholdVersion snapshot = thresholdStore.current();
        int workers = workerCount(targetThroughput);
        Semaphore slots = new Semaphore(workers);

        log.info("Batch started: {} records, {} workers, thresholds v{}",
                records.size(), workers, snapshot.getVersion());

        List<CompletableFuture<EvaluationOutcome>> futures = new ArrayList<>(records.size());
        boolean cancelled = false;
        for (int i = 0; i < records.size(); i++) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch dispatch interrupted after {} of {} records", i, records.size());
                cancelled = true;
                break;
            }
            final int index = i;
            final MemoryRecord record = records.get(i);
            futures.add(CompletableFuture
                    .supplyAsync(() -> evaluateOne(index, record, snapshot), batchExecutor)
                    .whenComplete((outcome, error) -> slots.release()));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ValidationDecision> decisions = new ArrayList<>();
        List<BatchError> errors = new ArrayList<>();
        Map<ValidationOutcome, Integer> counts = new EnumMap<>(ValidationOutcome.class);
        for (ValidationOutcome outcome : ValidationOutcome.values()) {
            counts.put(outcome, 0);
        }
        double confidenceSum = 0.0;

        for (CompletableFuture<EvaluationOutcome> future : futures) {
            EvaluationOutcome outcome = future.join();
            if (outcome.isSuccess()) {
                ValidationDecision decision = outcome.getDecision();
                decisions.add(decision);
                counts.merge(decision.getOutcome(), 1, Integer::sum);
                confidenceSum += decision.getConfidence();
            } else {
                errors.add(outcome.getError());
            }
        }

        DistributionCheck check = distributionChecker.check(counts, errors.size());
        if (check.isFlagged()) {
            log.warn("Batch {} distribution flagged: {}", batchId, check.getFindings());
        }

        int skipped = records.size() - futures.size();
        long durationMs = System.currentTimeMillis() - start;
        double averageConfidence = decisions.isEmpty() ? 0.0
                : Math.round(confidenceSum / decisions.size() * 1000.0) / 1000.0;

        metricsConfig.recordBatch(records.size(), errors.size(), durationMs, check.isFlagged());
        log.info("Batch complete: {} processed, {} errors, {} skipped in {}ms (approve={}, review={}, reject={})",
                decisions.size(), errors.size(), skipped, durationMs,
                counts.get(ValidationOutcome.AUTO_APPROVE), counts.get(ValidationOutcome.REVIEW_REQUIRED),
                counts.get(ValidationOutcome.AUTO_REJECT));

        BatchResult result = BatchResult.builder()
                .batchId(batchId)
                .thresholdVersion(snapshot.getVersion())
                .totalRecords(records.size())
                .processedCount(decisions.size())
                .skippedCount(skipped)
                .decisionCounts(Collections.unmodifiableMap(counts))
                .averageConfidence(averageConfidence)
                .durationMs(durationMs)
                .workerCount(workers)
                .decisions(Collections.unmodifiableList(decisions))
                .errors(Collections.unmodifiableList(errors))
                .distributionCheck(check)
                .qualitySnapshot(qualityMonitorService.latest())
                .cancelled(cancelled)
                .build();
        analyticsService.recordBatch(result);
        return result;
    }

    private EvaluationOutcome evaluateOne(int index, MemoryRecord record, ThresholdVersion snapshot) {
        String recordId = record != null ? record.getId() : null;
        try {
            ValidationDecision decision = recordEvaluationService.evaluate(record, snapshot).getDecision();
            return EvaluationOutcome.success(index, decision);
        } catch (MalformedRecordException e) {
            metricsConfig.recordMalformedRecord();
            log.warn("Malformed record at index {} ({}): {}", index, recordId, e.getMessage());
            return EvaluationOutcome.failure(index, recordId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure evaluating record at index {} ({})", index, recordId, e);
            return EvaluationOutcome.failure(index, recordId, "Evaluation failed: " + e.getMessage());
        }
    }
}
