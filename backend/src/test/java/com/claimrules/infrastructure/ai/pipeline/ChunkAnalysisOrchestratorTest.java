package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.*;
import com.claimrules.domain.extraction.service.ReasoningClient;
import com.claimrules.infrastructure.ai.BatchPromptBuilder;
import com.claimrules.infrastructure.ai.ReasoningCallException;
import com.claimrules.infrastructure.ai.ReasoningResilienceConfig;
import com.claimrules.infrastructure.ai.parsing.RuleResponseParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChunkAnalysisOrchestratorTest {

    private static final String RESPONSE = """
            {"rules": [{"wild_type": "SEQ_ID_NO_1", "rule": "identity>90%", "mutation": "W46E/Q62W",
              "mutation_logic": "W46E&Q62W", "statement": "与SEQ ID NO:1具有至少90%同一性且包含W46E和Q62W突变的多肽"}]}""";

    @Mock
    private ReasoningClient reasoningClient;

    private ChunkAnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = orchestrator(Duration.ofSeconds(30));
    }

    private ChunkAnalysisOrchestrator orchestrator(Duration batchTimeout) {
        ObjectMapper objectMapper = new ObjectMapper();
        return new ChunkAnalysisOrchestrator(
                reasoningClient,
                ReasoningResilienceConfig.buildRetry(3, Duration.ofMillis(1), 1.5),
                ReasoningResilienceConfig.buildTimeLimiter(batchTimeout),
                new BatchPromptBuilder(objectMapper),
                new RuleResponseParser(objectMapper),
                new ConfidenceScorer(),
                new FallbackRuleSynthesizer()
        );
    }

    private static AnalysisBatch batch(int batchId, int... claimNumbers) {
        List<ClaimSegment> segments = Arrays.stream(claimNumbers)
                .mapToObj(n -> new ClaimSegment(n, "根据权利要求1所述的多肽，其中包含Y178A突变。",
                        n == 1 ? ClaimKind.INDEPENDENT : ClaimKind.DEPENDENT,
                        n == 1 ? Set.of() : Set.of(1), List.of(), Set.of("Y178A"), 1.4))
                .toList();
        return new AnalysisBatch(batchId, segments);
    }

    // ── Single batch ──

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("Successful call → parsed rules with confidence and token usage")
        void success() {
            when(reasoningClient.analyze(any())).thenReturn(new ReasoningResponse(RESPONSE, 120, 45));

            BatchAnalysisOutcome outcome = orchestrator.analyze(batch(1, 1, 2), List.of());

            assertThat(outcome.succeeded()).isTrue();
            assertThat(outcome.ruleCandidates()).hasSize(1);
            assertThat(outcome.claimNumbers()).containsExactly(1, 2);
            // 0.5 + min(0.2 * 1/2, 0.3) + 0.2 * 3/3
            assertThat(outcome.confidence()).isCloseTo(0.8, within(1e-9));
            assertThat(outcome.promptTokens()).isEqualTo(120);
            assertThat(outcome.completionTokens()).isEqualTo(45);
        }

        @Test
        @DisplayName("Transient failure is retried")
        void transient_failure() {
            when(reasoningClient.analyze(any()))
                    .thenThrow(new ReasoningCallException("upstream 503"))
                    .thenReturn(new ReasoningResponse(RESPONSE, 10, 10));

            BatchAnalysisOutcome outcome = orchestrator.analyze(batch(1, 1), List.of());

            assertThat(outcome.fallbackUsed()).isFalse();
            verify(reasoningClient, times(2)).analyze(any());
        }

        @Test
        @DisplayName("Retries exhausted → needs-review placeholders, confidence 0")
        void retries_exhausted() {
            when(reasoningClient.analyze(any())).thenThrow(new ReasoningCallException("upstream 503"));

            BatchAnalysisOutcome outcome = orchestrator.analyze(batch(4, 7, 8), List.of());

            assertThat(outcome.fallbackUsed()).isTrue();
            assertThat(outcome.confidence()).isZero();
            assertThat(outcome.failureStage()).isEqualTo(ProcessingLogEntry.Stage.ANALYSIS);
            assertThat(outcome.errorMessage()).contains("reasoning call failed", "upstream 503");
            assertThat(outcome.ruleCandidates()).hasSize(2)
                    .allSatisfy(rule -> {
                        assertThat(rule.needsReview()).isTrue();
                        assertThat(rule.ruleLabel()).isEqualTo(FallbackRuleSynthesizer.NEEDS_REVIEW_LABEL);
                        assertThat(rule.provenance().batchIds()).containsExactly(4);
                    });
            verify(reasoningClient, times(3)).analyze(any());
        }

        @Test
        @DisplayName("Unparseable reply → fallback without retrying")
        void unparseable() {
            when(reasoningClient.analyze(any())).thenReturn(new ReasoningResponse("I cannot help with that.", 10, 5));

            BatchAnalysisOutcome outcome = orchestrator.analyze(batch(1, 1), List.of());

            assertThat(outcome.fallbackUsed()).isTrue();
            assertThat(outcome.errorMessage()).startsWith("unparseable response");
            assertThat(outcome.failureStage()).isEqualTo(ProcessingLogEntry.Stage.PARSING);
            verify(reasoningClient, times(1)).analyze(any());
        }
    }

    // ── All batches ──

    @Nested
    @DisplayName("analyzeAll")
    class AnalyzeAll {

        @Test
        @DisplayName("One outcome per batch, in batch-id order, failures isolated")
        void ordered_and_isolated() {
            when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
                ReasoningPrompt prompt = invocation.getArgument(0);
                if (prompt.userMessage().contains("\"batch_id\":2")) {
                    throw new ReasoningCallException("rate limited");
                }
                return new ReasoningResponse(RESPONSE, 10, 10);
            });

            List<BatchAnalysisOutcome> outcomes = orchestrator.analyzeAll(
                    List.of(batch(1, 1, 2), batch(2, 3, 4), batch(3, 5)), List.of(), 2);

            assertThat(outcomes).extracting(BatchAnalysisOutcome::batchId).containsExactly(1, 2, 3);
            assertThat(outcomes).extracting(BatchAnalysisOutcome::fallbackUsed).containsExactly(false, true, false);
            assertThat(outcomes).allSatisfy(o -> assertThat(o.confidence()).isBetween(0.0, 1.0));
        }

        @Test
        @DisplayName("Batch past its deadline → fallback")
        void deadline() {
            orchestrator = orchestrator(Duration.ofSeconds(1));
            when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return new ReasoningResponse(RESPONSE, 10, 10);
            });

            List<BatchAnalysisOutcome> outcomes = orchestrator.analyzeAll(List.of(batch(1, 1)), List.of(), 1);

            assertThat(outcomes).singleElement().satisfies(outcome -> {
                assertThat(outcome.fallbackUsed()).isTrue();
                assertThat(outcome.errorMessage()).contains("deadline of 1000ms");
                assertThat(outcome.failureStage()).isEqualTo(ProcessingLogEntry.Stage.ANALYSIS);
            });
        }

        @Test
        @DisplayName("Time spent queued behind other batches does not count against the deadline")
        void deadline_starts_with_call() {
            orchestrator = orchestrator(Duration.ofSeconds(1));
            when(reasoningClient.analyze(any())).thenAnswer(invocation -> {
                Thread.sleep(700);
                return new ReasoningResponse(RESPONSE, 10, 10);
            });

            List<BatchAnalysisOutcome> outcomes = orchestrator.analyzeAll(
                    List.of(batch(1, 1), batch(2, 2)), List.of(), 1);

            assertThat(outcomes).extracting(BatchAnalysisOutcome::fallbackUsed).containsExactly(false, false);
            assertThat(outcomes).extracting(BatchAnalysisOutcome::errorMessage).containsOnlyNulls();
            verify(reasoningClient, times(2)).analyze(any());
        }

        @Test
        @DisplayName("No batches → no outcomes")
        void empty() {
            assertThat(orchestrator.analyzeAll(List.of(), List.of(), 4)).isEmpty();
        }
    }
}
