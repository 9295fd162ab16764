package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.*;
import com.claimrules.domain.extraction.service.ReasoningClient;
import com.claimrules.infrastructure.ai.BatchPromptBuilder;
import com.claimrules.infrastructure.ai.ReasoningCallException;
import com.claimrules.infrastructure.ai.ReasoningResilienceConfig;
import com.claimrules.infrastructure.ai.chunking.ChunkBuilder;
import com.claimrules.infrastructure.ai.merge.MergeMetricsCalculator;
import com.claimrules.infrastructure.ai.merge.RuleMerger;
import com.claimrules.infrastructure.ai.merge.RuleQualityEvaluator;
import com.claimrules.infrastructure.ai.parsing.RuleResponseParser;
import com.claimrules.infrastructure.ai.preprocessing.ClaimTextNormalizer;
import com.claimrules.infrastructure.ai.segmentation.ClaimSegmenter;
import com.claimrules.infrastructure.ai.segmentation.ClaimTokenizer;
import com.claimrules.infrastructure.ai.segmentation.ComplexityScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleExtractionPipelineTest {

    private static final String RESPONSE = """
            {"rules": [{"wild_type": "SEQ ID NO:1", "rule": "identity>90%", "mutation": "W46E/Q62W",
              "mutation_logic": "W46E&Q62W", "identity_logic": ">90%",
              "statement": "与SEQ ID NO:1具有至少90%同一性且包含W46E和Q62W突变的多肽"}]}""";

    private static final PipelineOptions OPTIONS = new PipelineOptions(3, 15.0, 2);

    @Mock
    private ReasoningClient reasoningClient;

    private RuleExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        ClaimSegmenter segmenter = new ClaimSegmenter(
                new ClaimTextNormalizer(), new ClaimTokenizer(), new ComplexityScorer());
        ChunkAnalysisOrchestrator orchestrator = new ChunkAnalysisOrchestrator(
                reasoningClient,
                ReasoningResilienceConfig.buildRetry(3, Duration.ofMillis(1), 1.5),
                ReasoningResilienceConfig.buildTimeLimiter(Duration.ofSeconds(30)),
                new BatchPromptBuilder(objectMapper),
                new RuleResponseParser(objectMapper),
                new ConfidenceScorer(),
                new FallbackRuleSynthesizer());

        pipeline = new RuleExtractionPipeline(
                segmenter,
                new ChunkingModeEvaluator(),
                new ChunkBuilder(),
                orchestrator,
                new RuleMerger(new RuleQualityEvaluator(), new MergeMetricsCalculator()),
                new RuleDocumentAssembler());
    }

    private static String claims(int count) {
        StringBuilder sb = new StringBuilder("1. 一种多肽，其包含与SEQ ID NO:1具有至少90%同一性的氨基酸序列。\n");
        for (int i = 2; i <= count; i++) {
            sb.append(i).append(". 根据权利要求1所述的多肽，其中包含突变Y").append(100 + i).append("A。\n");
        }
        return sb.toString();
    }

    @Test
    @DisplayName("12 claims, batch 3 fails → placeholders for its claims, completeness 0.75")
    void partial_failure() {
        when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
            ReasoningPrompt prompt = invocation.getArgument(0);
            if (prompt.userMessage().contains("\"batch_id\":3")) {
                throw new ReasoningCallException("upstream 503");
            }
            return new ReasoningResponse(RESPONSE, 200, 80);
        });

        RuleExtractionResult result = pipeline.execute("CN112345678A", "group-1", claims(12), List.of(), OPTIONS);

        assertThat(result.mode()).isEqualTo(AnalysisMode.CHUNKED);
        assertThat(result.batchCount()).isEqualTo(4);

        MergedRuleSet ruleSet = result.ruleSet();
        assertThat(ruleSet.completeness()).isCloseTo(0.75, within(1e-9));
        assertThat(ruleSet.rules()).hasSize(4);

        // identical replies from batches 1, 2 and 4 collapse into one rule
        RuleCandidate top = ruleSet.rules().get(0).candidate();
        assertThat(top.needsReview()).isFalse();
        assertThat(top.wildType()).isEqualTo("SEQ_ID_NO_1");
        assertThat(top.provenance().batchIds()).containsExactly(1, 2, 4);
        assertThat(ruleSet.mergeStats().exactDuplicatesRemoved()).isEqualTo(2);

        assertThat(ruleSet.rules().subList(1, 4))
                .allSatisfy(rule -> assertThat(rule.candidate().needsReview()).isTrue())
                .extracting(rule -> rule.candidate().provenance().claimNumbers().iterator().next())
                .containsExactlyInAnyOrder(7, 8, 9);

        assertThat(ruleSet.analysisSummary().totalBatches()).isEqualTo(4);
        assertThat(ruleSet.analysisSummary().failedBatches()).isEqualTo(1);
        assertThat(ruleSet.processingStats().errorCount()).isEqualTo(1);
        assertThat(ruleSet.processingStats().promptTokens()).isEqualTo(600);

        assertThat(result.processingLog()).singleElement().satisfies(entry -> {
            assertThat(entry.severity()).isEqualTo(ProcessingLogEntry.Severity.ERROR);
            assertThat(entry.stage()).isEqualTo(ProcessingLogEntry.Stage.ANALYSIS);
            assertThat(entry.batchId()).isEqualTo(3);
        });

        PatentRuleDocument document = result.document();
        assertThat(document.patentNumber()).isEqualTo("CN112345678A");
        assertThat(document.group()).isEqualTo("group-1");
        assertThat(document.rules()).hasSize(4);
        assertThat(document.metadata().totalRules()).isEqualTo(4);
        assertThat(document.metadata().claimsAnalyzed()).isEqualTo(12);
        assertThat(document.metadata().analysisMode()).isEqualTo(AnalysisMode.CHUNKED);
        assertThat(document.metadata().completeness()).isCloseTo(0.75, within(1e-9));

        // 3 successful calls + 3 attempts for the failing batch
        verify(reasoningClient, times(6)).analyze(any());
    }

    @Test
    @DisplayName("Small document → single pass, known rules sent as examples")
    void single_pass() {
        when(reasoningClient.analyze(any())).thenReturn(new ReasoningResponse(RESPONSE, 100, 40));
        List<RuleEntry> knownRules = List.of(
                new RuleEntry("SEQ_ID_NO_9", "identical", "", "", "", "known rule statement", ""));

        RuleExtractionResult result = pipeline.execute("CN1", null, claims(3), knownRules, OPTIONS);

        assertThat(result.mode()).isEqualTo(AnalysisMode.SINGLE_PASS);
        assertThat(result.batchCount()).isEqualTo(1);
        assertThat(result.ruleSet().completeness()).isEqualTo(1.0);
        assertThat(result.processingLog()).isEmpty();

        ArgumentCaptor<ReasoningPrompt> captor = ArgumentCaptor.forClass(ReasoningPrompt.class);
        verify(reasoningClient).analyze(captor.capture());
        assertThat(captor.getValue().userMessage()).contains("known rule statement");
    }

    @Test
    @DisplayName("Unparseable reply → placeholders logged under the parsing stage")
    void unparseable_reply() {
        when(reasoningClient.analyze(any())).thenReturn(new ReasoningResponse("无法分析该权利要求。", 100, 10));

        RuleExtractionResult result = pipeline.execute("CN1", null, claims(3), List.of(), OPTIONS);

        assertThat(result.ruleSet().rules()).hasSize(3)
                .allSatisfy(rule -> assertThat(rule.candidate().needsReview()).isTrue());
        assertThat(result.processingLog()).singleElement().satisfies(entry -> {
            assertThat(entry.severity()).isEqualTo(ProcessingLogEntry.Severity.ERROR);
            assertThat(entry.stage()).isEqualTo(ProcessingLogEntry.Stage.PARSING);
            assertThat(entry.message()).contains("unparseable response");
        });
        verify(reasoningClient, times(1)).analyze(any());
    }

    @Test
    @DisplayName("No claims → empty rule set with a warning, no reasoning call")
    void empty_input() {
        RuleExtractionResult result = pipeline.execute("CN1", null, "", List.of(), OPTIONS);

        assertThat(result.batchCount()).isZero();
        assertThat(result.ruleSet().rules()).isEmpty();
        assertThat(result.ruleSet().completeness()).isZero();
        assertThat(result.document().metadata().totalRules()).isZero();
        assertThat(result.processingLog()).singleElement()
                .satisfies(entry -> assertThat(entry.severity()).isEqualTo(ProcessingLogEntry.Severity.WARNING));
        verifyNoInteractions(reasoningClient);
    }

    @Test
    @DisplayName("Pre-segmented input skips segmentation")
    void pre_segmented() {
        when(reasoningClient.analyze(any())).thenReturn(new ReasoningResponse(RESPONSE, 100, 40));
        List<ClaimSegment> segments = List.of(
                new ClaimSegment(1, "一种多肽", ClaimKind.INDEPENDENT, null, null, null, 1.0),
                new ClaimSegment(2, "根据权利要求1所述的多肽", ClaimKind.DEPENDENT, Set.of(1), null, null, 1.0));

        RuleExtractionResult result = pipeline.executeSegments("CN1", null, segments, null, OPTIONS);

        assertThat(result.document().metadata().claimsAnalyzed()).isEqualTo(2);
        assertThat(result.ruleSet().rules()).hasSize(1);
    }
}
