package com.claimrules.domain.extraction.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output document: all protection rules extracted for one patent.
 */
public record PatentRuleDocument(
        @JsonProperty("patent_number") String patentNumber,
        @JsonProperty("group") String group,
        @JsonProperty("rules") List<RuleEntry> rules,
        @JsonProperty("metadata") Metadata metadata
) {

    public PatentRuleDocument {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public record Metadata(
            @JsonProperty("total_rules") int totalRules,
            @JsonProperty("claims_analyzed") int claimsAnalyzed,
            @JsonProperty("processing_timestamp") String processingTimestamp,
            @JsonProperty("analysis_confidence") double analysisConfidence,
            @JsonProperty("analysis_mode") AnalysisMode analysisMode,
            @JsonProperty("completeness") double completeness
    ) {}
}
