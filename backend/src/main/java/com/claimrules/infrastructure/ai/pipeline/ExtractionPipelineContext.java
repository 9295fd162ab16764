package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.*;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context object passed through pipeline stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class ExtractionPipelineContext {

    // --- Input ---
    private String patentNumber;
    private String group;
    private List<RuleEntry> knownRules = List.of();
    private PipelineOptions options;

    // --- Segmentation ---
    private List<ClaimSegment> segments = List.of();

    // --- Chunking ---
    private AnalysisMode mode = AnalysisMode.SINGLE_PASS;
    private List<AnalysisBatch> batches = List.of();

    // --- Analysis ---
    private List<BatchAnalysisOutcome> outcomes = List.of();

    // --- Merge ---
    private MergedRuleSet ruleSet;
    private PatentRuleDocument document;

    // --- Log ---
    private List<ProcessingLogEntry> processingLog = new ArrayList<>();

    public void addLogEntry(ProcessingLogEntry entry) {
        processingLog.add(entry);
    }

    /**
     * Build the final result from accumulated context.
     */
    public RuleExtractionResult toResult() {
        return new RuleExtractionResult(document, ruleSet, mode, batches.size(), processingLog);
    }
}
