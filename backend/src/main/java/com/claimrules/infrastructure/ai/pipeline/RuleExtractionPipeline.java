package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.*;
import com.claimrules.domain.extraction.model.ProcessingLogEntry.Stage;
import com.claimrules.infrastructure.ai.chunking.ChunkBuilder;
import com.claimrules.infrastructure.ai.merge.RuleMerger;
import com.claimrules.infrastructure.ai.segmentation.ClaimSegmenter;
import com.claimrules.infrastructure.ai.segmentation.SegmentationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Orchestrates the full extraction pipeline for one patent:
 * <p>
 * segment → decide mode → build batches → analyze batches (concurrently) → merge → document
 * </p>
 * The merge starts only once every batch has an outcome. Failures of individual batches are
 * recovered downstream and reported in the processing log; only invalid options fail the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleExtractionPipeline {

    private final ClaimSegmenter claimSegmenter;
    private final ChunkingModeEvaluator modeEvaluator;
    private final ChunkBuilder chunkBuilder;
    private final ChunkAnalysisOrchestrator orchestrator;
    private final RuleMerger ruleMerger;
    private final RuleDocumentAssembler documentAssembler;

    /**
     * Execute the full pipeline from raw claim text.
     */
    public RuleExtractionResult execute(String patentNumber,
                                        String group,
                                        String claimsText,
                                        List<RuleEntry> knownRules,
                                        PipelineOptions options) {
        ExtractionPipelineContext ctx = newContext(patentNumber, group, knownRules, options);

        // 1. Segment
        SegmentationResult segmentation = claimSegmenter.segment(claimsText);
        ctx.setSegments(segmentation.segments());
        segmentation.issues().forEach(ctx::addLogEntry);

        return run(ctx);
    }

    /**
     * Execute the pipeline on segments produced elsewhere.
     */
    public RuleExtractionResult executeSegments(String patentNumber,
                                                String group,
                                                List<ClaimSegment> segments,
                                                List<RuleEntry> knownRules,
                                                PipelineOptions options) {
        ExtractionPipelineContext ctx = newContext(patentNumber, group, knownRules, options);
        ctx.setSegments(segments == null ? List.of() : List.copyOf(segments));
        return run(ctx);
    }

    // ===== Internal methods =====

    private ExtractionPipelineContext newContext(String patentNumber, String group,
                                                 List<RuleEntry> knownRules, PipelineOptions options) {
        Objects.requireNonNull(options, "options");
        ExtractionPipelineContext ctx = new ExtractionPipelineContext();
        ctx.setPatentNumber(patentNumber);
        ctx.setGroup(group);
        ctx.setKnownRules(knownRules == null ? List.of() : List.copyOf(knownRules));
        ctx.setOptions(options);
        return ctx;
    }

    private RuleExtractionResult run(ExtractionPipelineContext ctx) {
        long start = System.currentTimeMillis();

        if (ctx.getSegments().isEmpty()) {
            log.warn("[Pipeline] {}: no claims to analyze", ctx.getPatentNumber());
            ctx.addLogEntry(ProcessingLogEntry.warning(Stage.PIPELINE, "No claims found in input"));
            merge(ctx);
            return ctx.toResult();
        }

        // 2. Decide mode and build batches
        buildBatches(ctx);

        // 3. Analyze
        analyze(ctx);

        // 4. Merge and assemble
        merge(ctx);

        log.info("[Pipeline] {}: {} claims, mode={}, {} batches, {} rules, completeness={}, {}ms",
                ctx.getPatentNumber(), ctx.getSegments().size(), ctx.getMode(), ctx.getBatches().size(),
                ctx.getRuleSet().size(), String.format("%.2f", ctx.getRuleSet().completeness()),
                System.currentTimeMillis() - start);

        return ctx.toResult();
    }

    private void buildBatches(ExtractionPipelineContext ctx) {
        AnalysisMode mode = modeEvaluator.decide(ctx.getSegments());
        ctx.setMode(mode);

        PipelineOptions options = ctx.getOptions();
        if (mode == AnalysisMode.CHUNKED) {
            ctx.setBatches(chunkBuilder.build(ctx.getSegments(), options.maxBatchSize(), options.complexityBudget()));
        } else {
            ctx.setBatches(List.of(AnalysisBatch.wholeDocument(ctx.getSegments())));
        }
    }

    private void analyze(ExtractionPipelineContext ctx) {
        List<BatchAnalysisOutcome> outcomes = orchestrator.analyzeAll(
                ctx.getBatches(), ctx.getKnownRules(), ctx.getOptions().concurrency());
        ctx.setOutcomes(outcomes);

        for (BatchAnalysisOutcome outcome : outcomes) {
            if (outcome.fallbackUsed()) {
                ctx.addLogEntry(ProcessingLogEntry.error(outcome.failureStage(), outcome.batchId(),
                        "Claims " + outcome.claimNumbers() + " need review: " + outcome.errorMessage()));
            }
        }
    }

    private void merge(ExtractionPipelineContext ctx) {
        MergedRuleSet ruleSet = ruleMerger.merge(ctx.getOutcomes());
        ctx.setRuleSet(ruleSet);
        ctx.setDocument(documentAssembler.assemble(
                ctx.getPatentNumber(), ctx.getGroup(), ruleSet,
                ctx.getSegments().size(), ctx.getOutcomes(), ctx.getMode()));
    }
}
