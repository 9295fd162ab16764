package com.claimrules.infrastructure.ai.merge;

import com.claimrules.domain.extraction.model.LogicalExpressions;
import com.claimrules.domain.extraction.model.RuleCandidate;
import org.springframework.stereotype.Component;

/**
 * Completeness/consistency score of a single rule, in [0, 1].
 * <ul>
 *   <li>+0.2 each for non-blank wild type, rule label and statement</li>
 *   <li>+0.2 for a well-formed logical expression</li>
 *   <li>+0.2 for a real (non-placeholder) mutation descriptor</li>
 * </ul>
 */
@Component
public class RuleQualityEvaluator {

    private static final double FIELD_WEIGHT = 0.2;

    public double evaluate(RuleCandidate candidate) {
        double score = 0.0;

        if (!candidate.wildType().isBlank()) {
            score += FIELD_WEIGHT;
        }
        if (!candidate.ruleLabel().isBlank()) {
            score += FIELD_WEIGHT;
        }
        if (!candidate.statement().isBlank()) {
            score += FIELD_WEIGHT;
        }
        if (LogicalExpressions.isWellFormed(candidate.logicalExpression())) {
            score += FIELD_WEIGHT;
        }
        if (!candidate.needsReview() && !candidate.mutationDescriptor().isBlank()) {
            score += FIELD_WEIGHT;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }
}
