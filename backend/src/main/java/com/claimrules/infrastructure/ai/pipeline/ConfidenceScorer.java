package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.LogicalExpressions;
import com.claimrules.domain.extraction.model.RuleCandidate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Heuristic confidence of one batch's extraction, in [0, 1].
 * <pre>
 * 0.0 when there are no rules, otherwise
 * 0.5 + min(0.2 * rulesPerClaim, 0.3) + 0.2 * passedChecks / (3 * ruleCount)
 * </pre>
 * Checks per rule: sequence-style wild type, operator in the logical expression,
 * statement longer than 20 characters.
 */
@Component
public class ConfidenceScorer {

    private static final double BASE = 0.5;
    private static final double DENSITY_CAP = 0.3;
    private static final double CHECK_WEIGHT = 0.2;
    private static final int CHECKS_PER_RULE = 3;
    private static final int MIN_STATEMENT_LENGTH = 20;

    private static final Pattern SEQUENCE_WILD_TYPE = Pattern.compile(
            "(?i)^SEQ[\\s_]*ID[\\s_]*NO[\\s_.:：]*\\d+$");

    public double score(List<RuleCandidate> candidates, int claimCount) {
        if (candidates == null || candidates.isEmpty()) {
            return 0.0;
        }

        double rulesPerClaim = (double) candidates.size() / Math.max(claimCount, 1);
        double confidence = BASE + Math.min(0.2 * rulesPerClaim, DENSITY_CAP);

        int passed = 0;
        for (RuleCandidate candidate : candidates) {
            if (SEQUENCE_WILD_TYPE.matcher(candidate.wildType()).matches()) {
                passed++;
            }
            if (LogicalExpressions.hasOperator(candidate.logicalExpression())) {
                passed++;
            }
            if (candidate.statement().length() > MIN_STATEMENT_LENGTH) {
                passed++;
            }
        }
        confidence += CHECK_WEIGHT * passed / (CHECKS_PER_RULE * (double) candidates.size());

        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
