package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.AnalysisBatch;
import com.claimrules.domain.extraction.model.BatchAnalysisOutcome;
import com.claimrules.domain.extraction.model.ProcessingLogEntry.Stage;
import com.claimrules.domain.extraction.model.ReasoningPrompt;
import com.claimrules.domain.extraction.model.ReasoningResponse;
import com.claimrules.domain.extraction.model.RuleCandidate;
import com.claimrules.domain.extraction.model.RuleEntry;
import com.claimrules.domain.extraction.service.ReasoningClient;
import com.claimrules.infrastructure.ai.BatchPromptBuilder;
import com.claimrules.infrastructure.ai.ReasoningCallException;
import com.claimrules.infrastructure.ai.parsing.ResponseParseException;
import com.claimrules.infrastructure.ai.parsing.RuleResponseParser;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one reasoning call per batch and turns the reply into rule candidates.
 * <p>
 * prompt → call (retried with backoff, bounded by the batch deadline) → parse (3 strategies) → confidence
 * </p>
 * The deadline starts when the batch's call starts, not when the batch is queued.
 * Any failure (retries exhausted, deadline passed, unparseable reply) yields a fallback
 * outcome with needs-review placeholders. Nothing is thrown to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkAnalysisOrchestrator {

    private final ReasoningClient reasoningClient;
    private final Retry reasoningRetry;
    private final TimeLimiter reasoningTimeLimiter;
    private final BatchPromptBuilder promptBuilder;
    private final RuleResponseParser responseParser;
    private final ConfidenceScorer confidenceScorer;
    private final FallbackRuleSynthesizer fallbackSynthesizer;

    /**
     * Analyze one batch synchronously.
     */
    public BatchAnalysisOutcome analyze(AnalysisBatch batch, List<RuleEntry> knownRules) {
        ExecutorService callExecutor = Executors.newSingleThreadExecutor(threadFactory("reasoning-call-"));
        try {
            return analyze(batch, knownRules, callExecutor);
        } finally {
            callExecutor.shutdownNow();
        }
    }

    /**
     * Analyze all batches on a pool of {@code concurrency} threads owned by this call.
     * Outcomes come back in batch-id order, one per batch.
     */
    public List<BatchAnalysisOutcome> analyzeAll(List<AnalysisBatch> batches, List<RuleEntry> knownRules,
                                                 int concurrency) {
        if (batches == null || batches.isEmpty()) {
            return List.of();
        }

        int poolSize = Math.max(1, Math.min(concurrency, batches.size()));
        ExecutorService workers = Executors.newFixedThreadPool(poolSize, threadFactory("batch-analysis-"));
        // Each worker waits on at most one call at a time
        ExecutorService callExecutor = Executors.newCachedThreadPool(threadFactory("reasoning-call-"));
        try {
            List<CompletableFuture<BatchAnalysisOutcome>> futures = new ArrayList<>();
            for (AnalysisBatch batch : batches) {
                futures.add(submit(batch, knownRules, workers, callExecutor));
            }

            List<BatchAnalysisOutcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<BatchAnalysisOutcome> future : futures) {
                outcomes.add(future.join());
            }
            outcomes.sort(Comparator.comparingInt(BatchAnalysisOutcome::batchId));

            long failed = outcomes.stream().filter(BatchAnalysisOutcome::fallbackUsed).count();
            log.info("[Orchestrator] {} batches analyzed with concurrency {}, {} fell back",
                    outcomes.size(), poolSize, failed);
            return outcomes;
        } finally {
            workers.shutdownNow();
            callExecutor.shutdownNow();
        }
    }

    // ===== Internal methods =====

    private CompletableFuture<BatchAnalysisOutcome> submit(AnalysisBatch batch, List<RuleEntry> knownRules,
                                                           ExecutorService workers, ExecutorService callExecutor) {
        return CompletableFuture
                .supplyAsync(() -> analyze(batch, knownRules, callExecutor), workers)
                .exceptionally(e -> {
                    log.error("[Orchestrator] Batch {} task failed", batch.batchId(), e);
                    return fallbackSynthesizer.synthesize(batch, Stage.ANALYSIS, "task failed: " + e.getMessage(), 0);
                });
    }

    private BatchAnalysisOutcome analyze(AnalysisBatch batch, List<RuleEntry> knownRules,
                                         ExecutorService callExecutor) {
        long start = System.currentTimeMillis();
        try {
            ReasoningPrompt prompt = promptBuilder.build(batch, knownRules);
            ReasoningResponse response = callWithDeadline(prompt, callExecutor);

            List<RuleCandidate> candidates = responseParser.parse(response.content(), batch);
            double confidence = confidenceScorer.score(candidates, batch.size());
            long elapsed = System.currentTimeMillis() - start;

            log.info("[Orchestrator] Batch {} ({} claims): {} rules, confidence={}, {}ms",
                    batch.batchId(), batch.size(), candidates.size(), String.format("%.2f", confidence), elapsed);

            return new BatchAnalysisOutcome(
                    batch.batchId(),
                    batch.claimNumbers(),
                    confidence,
                    candidates,
                    null,
                    elapsed,
                    false,
                    response.promptTokens(),
                    response.completionTokens(),
                    null
            );
        } catch (TimeoutException e) {
            long deadlineMs = reasoningTimeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis();
            return fallback(batch, Stage.ANALYSIS, "batch deadline of " + deadlineMs + "ms exceeded", start);
        } catch (ReasoningCallException e) {
            return fallback(batch, Stage.ANALYSIS, "reasoning call failed: " + e.getMessage(), start);
        } catch (ResponseParseException e) {
            return fallback(batch, Stage.PARSING, "unparseable response: " + e.getMessage(), start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(batch, Stage.ANALYSIS, "analysis interrupted", start);
        } catch (Exception e) {
            log.error("[Orchestrator] Unexpected failure in batch {}", batch.batchId(), e);
            return fallback(batch, Stage.ANALYSIS, "unexpected failure: " + e.getMessage(), start);
        }
    }

    /**
     * Retried call on {@code callExecutor}, cancelled once the batch deadline passes.
     * Call failures surface unwrapped, a passed deadline as {@link TimeoutException}.
     */
    private ReasoningResponse callWithDeadline(ReasoningPrompt prompt, ExecutorService callExecutor) throws Exception {
        Callable<ReasoningResponse> retriedCall = () ->
                Retry.decorateSupplier(reasoningRetry, () -> reasoningClient.analyze(prompt)).get();
        return reasoningTimeLimiter.executeFutureSupplier(() -> callExecutor.submit(retriedCall));
    }

    private BatchAnalysisOutcome fallback(AnalysisBatch batch, Stage stage, String reason, long start) {
        long elapsed = System.currentTimeMillis() - start;
        log.warn("[Orchestrator] Batch {} falls back to needs-review placeholders: {}", batch.batchId(), reason);
        return fallbackSynthesizer.synthesize(batch, stage, reason, elapsed);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
