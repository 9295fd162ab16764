package com.claimrules.interfaces.api.dto;

import com.claimrules.domain.extraction.model.AnalysisMode;
import com.claimrules.domain.extraction.model.AnalysisSummary;
import com.claimrules.domain.extraction.model.MergedRuleSet;
import com.claimrules.domain.extraction.model.PatentRuleDocument;
import com.claimrules.domain.extraction.model.ProcessingLogEntry;
import com.claimrules.domain.extraction.model.ProcessingStats;
import com.claimrules.domain.extraction.model.QualityMetrics;
import com.claimrules.domain.extraction.model.RuleExtractionResult;

import java.util.List;

public record ExtractionResponse(
        PatentRuleDocument document,
        AnalysisMode mode,
        int batchCount,
        double completeness,
        QualityMetrics qualityMetrics,
        ProcessingStats processingStats,
        AnalysisSummary analysisSummary,
        List<ProcessingLogEntry> processingLog
) {

    public static ExtractionResponse from(RuleExtractionResult result) {
        MergedRuleSet ruleSet = result.ruleSet();
        return new ExtractionResponse(
                result.document(),
                result.mode(),
                result.batchCount(),
                ruleSet.completeness(),
                ruleSet.qualityMetrics(),
                ruleSet.processingStats(),
                ruleSet.analysisSummary(),
                result.processingLog()
        );
    }
}
