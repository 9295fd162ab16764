package com.claimrules.domain.extraction.model;

import java.util.List;

public record RuleExtractionResult(
        PatentRuleDocument document,
        MergedRuleSet ruleSet,
        AnalysisMode mode,
        int batchCount,
        List<ProcessingLogEntry> processingLog
) {

    public RuleExtractionResult {
        processingLog = processingLog == null ? List.of() : List.copyOf(processingLog);
    }
}
