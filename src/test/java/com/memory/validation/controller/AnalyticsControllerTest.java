package com.memory.validation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memory.validation.model.AnalyticsReport;
import com.memory.validation.model.CoverageAnalysis;
import com.memory.validation.model.EffectivenessMetrics;
import com.memory.validation.model.HealthStatus;
import com.memory.validation.model.MemoryRecord;
import com.memory.validation.model.QualityDistribution;
import com.memory.validation.model.QualityMetrics;
import com.memory.validation.model.SampledRecords;
import com.memory.validation.model.SamplingEffectiveness;
import com.memory.validation.model.SamplingStrategy;
import com.memory.validation.model.TemporalDistribution;
import com.memory.validation.service.ValidationAnalyticsService;
import com.memory.validation.service.ValidationSamplingService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.memory.validation.testutil.TestDataFactory.createUniformRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ValidationAnalyticsService analyticsService;

    @MockBean
    private ValidationSamplingService samplingService;

    @Test
    void getReport_returnsHealthAndTrends() throws Exception {
        when(analyticsService.report()).thenReturn(AnalyticsReport.builder()
                .generatedAt(1L)
                .accuracy(QualityMetrics.empty())
                .performance(AnalyticsReport.PerformanceSummary.builder().totalRecordsProcessed(250).build())
                .batchTrends(List.of())
                .systemHealth(AnalyticsReport.SystemHealth.builder()
                        .status(HealthStatus.WARNING).score(0.7).issues(List.of("Low throughput")).build())
                .recommendations(List.of())
                .build());

        mockMvc.perform(get("/api/v1/analytics/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.systemHealth.status").value("WARNING"))
                .andExpect(jsonPath("$.systemHealth.issues[0]").value("Low throughput"))
                .andExpect(jsonPath("$.performance.totalRecordsProcessed").value(250));
    }

    @Test
    void getEffectiveness_returnsMetrics() throws Exception {
        when(analyticsService.effectiveness()).thenReturn(EffectivenessMetrics.builder()
                .autoApprovalRate(0.3).humanWorkloadReduction(0.8).overallEffectiveness(0.69).batchesConsidered(10)
                .build());

        mockMvc.perform(get("/api/v1/analytics/effectiveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.humanWorkloadReduction").value(0.8))
                .andExpect(jsonPath("$.batchesConsidered").value(10));
    }

    @Test
    void getSamplingEffectiveness_returnsRecommendations() throws Exception {
        when(analyticsService.samplingEffectiveness()).thenReturn(SamplingEffectiveness.builder()
                .recommendations(List.of("No sampling data available")).build());

        mockMvc.perform(get("/api/v1/analytics/sampling-effectiveness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendations[0]").value("No sampling data available"));
    }

    @Test
    void sample_withTargetAndSeed_usesDefaultStrategyWithSeed() throws Exception {
        when(samplingService.defaultStrategy(25)).thenReturn(SamplingStrategy.builder()
                .name("balanced-stratified-sampling").targetSize(25).byEmotion(true).build());
        when(samplingService.sample(anyList(), any(SamplingStrategy.class))).thenReturn(sampled(42L));

        mockMvc.perform(post("/api/v1/analytics/sample")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "records", List.of(createUniformRecord("MEM-1", 0.8)),
                                "targetSize", 25,
                                "seed", 42))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seed").value(42))
                .andExpect(jsonPath("$.coverage.overallScore").value(0.6));

        ArgumentCaptor<SamplingStrategy> strategy = ArgumentCaptor.forClass(SamplingStrategy.class);
        verify(samplingService).sample(anyList(), strategy.capture());
        assertThat(strategy.getValue().getSeed()).isEqualTo(42L);
        assertThat(strategy.getValue().getTargetSize()).isEqualTo(25);
        verify(samplingService, never()).recommendStrategy(anyList());
    }

    @Test
    void sample_withoutTarget_recommendsStrategy() throws Exception {
        when(samplingService.recommendStrategy(anyList())).thenReturn(SamplingStrategy.builder()
                .name("simple-random").targetSize(1).build());
        when(samplingService.sample(anyList(), any(SamplingStrategy.class))).thenReturn(sampled(5L));

        mockMvc.perform(post("/api/v1/analytics/sample")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "records", List.of(createUniformRecord("MEM-1", 0.8))))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("simple-random"));

        verify(samplingService).recommendStrategy(anyList());
    }

    @Test
    void sample_emptyRecords_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analytics/sample")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("records must be a non-empty list"));
    }

    @Test
    void sample_nonPositiveTarget_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analytics/sample")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "records", List.of(createUniformRecord("MEM-1", 0.8)),
                                "targetSize", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("targetSize must be > 0"));

        verify(samplingService, never()).sample(anyList(), any(SamplingStrategy.class));
    }

    @Test
    void recommendStrategy_returnsStrategy() throws Exception {
        when(samplingService.recommendStrategy(anyList())).thenReturn(SamplingStrategy.builder()
                .name("simple-random").targetSize(1).expectedCoverage(0.7).build());

        mockMvc.perform(post("/api/v1/analytics/sample/strategy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "records", List.of(createUniformRecord("MEM-1", 0.8))))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("simple-random"))
                .andExpect(jsonPath("$.expectedCoverage").value(0.7));
    }

    private static SampledRecords sampled(long seed) {
        MemoryRecord record = createUniformRecord("MEM-1", 0.8);
        return SampledRecords.builder()
                .samples(List.of(record))
                .coverage(CoverageAnalysis.builder()
                        .emotionalCoverage(CoverageAnalysis.EmotionalCoverage.builder()
                                .represented(List.of("STABLE")).coveragePercentage(11.111).gaps(List.of()).build())
                        .temporalCoverage(CoverageAnalysis.TemporalCoverage.builder()
                                .distribution(TemporalDistribution.SPARSE).gaps(List.of()).build())
                        .relationshipCoverage(CoverageAnalysis.RelationshipCoverage.builder()
                                .represented(List.of()).coveragePercentage(0.0).build())
                        .qualityDistribution(QualityDistribution.builder().high(1).build())
                        .overallScore(0.6)
                        .build())
                .populationSize(1)
                .sampleSize(1)
                .samplingRate(1.0)
                .strategy(seed == 42L ? "balanced-stratified-sampling" : "simple-random")
                .seed(seed)
                .build();
    }
}
