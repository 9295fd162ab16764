package com.claimrules.domain.extraction.model;

/**
 * Identity of a rule for exact deduplication.
 */
public record RuleSignature(String wildType, RuleKind ruleKind, String mutationDescriptor, String logicalExpression) {

    public RuleSignature {
        wildType = wildType == null ? "" : wildType.strip();
        ruleKind = ruleKind == null ? RuleKind.UNKNOWN : ruleKind;
        mutationDescriptor = mutationDescriptor == null ? "" : mutationDescriptor.strip();
        logicalExpression = logicalExpression == null ? "" : logicalExpression.strip();
    }
}
