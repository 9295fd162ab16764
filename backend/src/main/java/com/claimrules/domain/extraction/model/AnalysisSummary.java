package com.claimrules.domain.extraction.model;

import java.util.List;
import java.util.Map;

public record AnalysisSummary(
        int totalBatches,
        int successfulBatches,
        int failedBatches,
        double successRate,
        Map<RuleKind, Integer> ruleKindCounts,
        List<String> wildTypesCovered,
        double averageConfidence
) {

    public AnalysisSummary {
        ruleKindCounts = ruleKindCounts == null ? Map.of() : Map.copyOf(ruleKindCounts);
        wildTypesCovered = wildTypesCovered == null ? List.of() : List.copyOf(wildTypesCovered);
    }
}
