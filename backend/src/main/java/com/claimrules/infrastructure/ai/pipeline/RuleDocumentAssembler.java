package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.AnalysisMode;
import com.claimrules.domain.extraction.model.BatchAnalysisOutcome;
import com.claimrules.domain.extraction.model.MergedRule;
import com.claimrules.domain.extraction.model.MergedRuleSet;
import com.claimrules.domain.extraction.model.PatentRuleDocument;
import com.claimrules.domain.extraction.model.RuleEntry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Builds the output document from the merged rule set.
 */
@Component
public class RuleDocumentAssembler {

    public PatentRuleDocument assemble(String patentNumber, String group, MergedRuleSet ruleSet,
                                       int claimsAnalyzed, List<BatchAnalysisOutcome> outcomes,
                                       AnalysisMode mode) {
        List<RuleEntry> rules = ruleSet.rules().stream()
                .map(MergedRule::candidate)
                .map(RuleEntry::from)
                .toList();

        double confidence = outcomes.stream()
                .mapToDouble(BatchAnalysisOutcome::confidence)
                .average()
                .orElse(0.0);

        PatentRuleDocument.Metadata metadata = new PatentRuleDocument.Metadata(
                rules.size(),
                claimsAnalyzed,
                Instant.now().toString(),
                confidence,
                mode,
                ruleSet.completeness()
        );
        return new PatentRuleDocument(patentNumber, group, rules, metadata);
    }
}
