package com.claimrules.interfaces.api.extraction;

import com.claimrules.application.extraction.RuleExtractionAppService;
import com.claimrules.domain.extraction.exception.InvalidPipelineConfigException;
import com.claimrules.domain.extraction.model.*;
import com.claimrules.infrastructure.ai.ReasoningUsageTracker;
import com.claimrules.interfaces.api.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ExtractionControllerTest {

    @Mock
    private RuleExtractionAppService extractionAppService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ExtractionController(extractionAppService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static RuleExtractionResult result() {
        RuleEntry rule = new RuleEntry("SEQ_ID_NO_1", "identical", "W46E", "W46E", "", "statement", "");
        MergedRuleSet ruleSet = new MergedRuleSet(
                List.of(),
                1.0,
                QualityMetrics.empty(),
                ProcessingStats.empty(),
                new AnalysisSummary(1, 1, 0, 1.0, Map.of(RuleKind.IDENTICAL, 1), List.of("SEQ_ID_NO_1"), 0.8),
                new MergeStats(1, 0, 0, 1));
        PatentRuleDocument document = new PatentRuleDocument("CN112345678A", "g1", List.of(rule),
                new PatentRuleDocument.Metadata(1, 2, "2024-01-01T00:00:00Z", 0.8, AnalysisMode.SINGLE_PASS, 1.0));
        return new RuleExtractionResult(document, ruleSet, AnalysisMode.SINGLE_PASS, 1, List.of());
    }

    @Test
    @DisplayName("POST /api/v1/extractions → document with snake_case fields")
    void extract() throws Exception {
        when(extractionAppService.extract(any(), any(), any(), any(), any(), any(), any())).thenReturn(result());

        mockMvc.perform(post("/api/v1/extractions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patentNumber\":\"CN112345678A\",\"group\":\"g1\",\"claimsText\":\"1. 一种多肽。\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.document.patent_number").value("CN112345678A"))
                .andExpect(jsonPath("$.document.rules[0].wild_type").value("SEQ_ID_NO_1"))
                .andExpect(jsonPath("$.document.metadata.total_rules").value(1))
                .andExpect(jsonPath("$.mode").value("SINGLE_PASS"))
                .andExpect(jsonPath("$.completeness").value(1.0));
    }

    @Test
    @DisplayName("Blank claims text → 400 VALIDATION_ERROR")
    void blank_claims() throws Exception {
        mockMvc.perform(post("/api/v1/extractions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patentNumber\":\"CN1\",\"claimsText\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Claims text is required"));
        verifyNoInteractions(extractionAppService);
    }

    @Test
    @DisplayName("Invalid pipeline option → 400 INVALID_PIPELINE_CONFIG")
    void invalid_config() throws Exception {
        when(extractionAppService.extract(any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new InvalidPipelineConfigException("complexityBudget must be positive: NaN"));

        mockMvc.perform(post("/api/v1/extractions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patentNumber\":\"CN1\",\"claimsText\":\"1. 一种多肽。\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PIPELINE_CONFIG"));
    }

    @Test
    @DisplayName("Malformed JSON → 400 MALFORMED_REQUEST")
    void malformed() throws Exception {
        mockMvc.perform(post("/api/v1/extractions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patentNumber\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("GET /api/v1/extractions/defaults")
    void defaults() throws Exception {
        when(extractionAppService.defaultOptions()).thenReturn(new PipelineOptions(5, 15.0, 4));
        when(extractionAppService.getMaxClaimsLength()).thenReturn(200_000);

        mockMvc.perform(get("/api/v1/extractions/defaults"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxBatchSize").value(5))
                .andExpect(jsonPath("$.complexityBudget").value(15.0))
                .andExpect(jsonPath("$.concurrency").value(4))
                .andExpect(jsonPath("$.maxClaimsLength").value(200_000));
    }

    @Test
    @DisplayName("GET /api/v1/extractions/usage → cumulative request and token counters")
    void usage() throws Exception {
        ReasoningUsageTracker tracker = new ReasoningUsageTracker();
        tracker.recordUsage(120, 45);
        tracker.recordUsage(80, 15);
        tracker.recordFailure();
        tracker.recordFailure();
        when(extractionAppService.getUsageTracker()).thenReturn(tracker);

        mockMvc.perform(get("/api/v1/extractions/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRequests").value(4))
                .andExpect(jsonPath("$.failedRequests").value(2))
                .andExpect(jsonPath("$.failureRate").value(50.0))
                .andExpect(jsonPath("$.promptTokens").value(200))
                .andExpect(jsonPath("$.completionTokens").value(60));
    }
}
