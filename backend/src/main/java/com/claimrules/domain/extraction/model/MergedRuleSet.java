package com.claimrules.domain.extraction.model;

import java.util.List;

/**
 * Final, deduplicated rules of one document ordered by descending priority.
 */
public record MergedRuleSet(
        List<MergedRule> rules,
        double completeness,
        QualityMetrics qualityMetrics,
        ProcessingStats processingStats,
        AnalysisSummary analysisSummary,
        MergeStats mergeStats
) {

    public MergedRuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public int size() {
        return rules.size();
    }
}
