package com.claimrules.domain.extraction.model;

import java.util.Set;

/**
 * One rule fragment extracted from a batch, before merging.
 *
 * @param wildType           baseline sequence the rule is anchored to
 * @param ruleKind           parsed category of {@code ruleLabel}
 * @param ruleLabel          label as emitted, e.g. {@code identity>70%}
 * @param mutationDescriptor slash-joined mutation codes, invalid codes removed
 * @param logicalExpression  boolean expression over mutation codes
 * @param identityLogic      identity condition, e.g. {@code >=70%}
 * @param statement          human-readable rule statement
 * @param comment            free-form note
 * @param provenance         source batches and claims
 * @param needsReview        true for placeholders synthesized after a failed batch
 */
public record RuleCandidate(
        String wildType,
        RuleKind ruleKind,
        String ruleLabel,
        String mutationDescriptor,
        String logicalExpression,
        String identityLogic,
        String statement,
        String comment,
        RuleProvenance provenance,
        boolean needsReview
) {

    public RuleCandidate {
        wildType = nullToEmpty(wildType);
        ruleKind = ruleKind == null ? RuleKind.fromLabel(ruleLabel) : ruleKind;
        ruleLabel = nullToEmpty(ruleLabel);
        mutationDescriptor = MutationCodes.sanitize(mutationDescriptor);
        logicalExpression = nullToEmpty(logicalExpression);
        identityLogic = nullToEmpty(identityLogic);
        statement = nullToEmpty(statement);
        comment = nullToEmpty(comment);
        provenance = provenance == null ? RuleProvenance.empty() : provenance;
    }

    public RuleSignature signature() {
        return new RuleSignature(wildType, ruleKind, mutationDescriptor, logicalExpression);
    }

    public Set<String> mutationSet() {
        return Set.copyOf(MutationCodes.parse(mutationDescriptor));
    }

    public int mutationCount() {
        return MutationCodes.parse(mutationDescriptor).size();
    }

    public RuleCandidate withProvenance(RuleProvenance newProvenance) {
        return new RuleCandidate(wildType, ruleKind, ruleLabel, mutationDescriptor, logicalExpression,
                identityLogic, statement, comment, newProvenance, needsReview);
    }

    public RuleCandidate withMergedContent(String newDescriptor, String newExpression,
                                           String newComment, RuleProvenance newProvenance) {
        return new RuleCandidate(wildType, ruleKind, ruleLabel, newDescriptor, newExpression,
                identityLogic, statement, newComment, newProvenance, needsReview);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.strip();
    }
}
