package com.claimrules.domain.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serialized form of a protection rule. Used for the output document and for the
 * known-rule sample passed in by callers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleEntry(
        @JsonProperty("wild_type") String wildType,
        @JsonProperty("rule") String rule,
        @JsonProperty("mutation") String mutation,
        @JsonProperty("mutation_logic") String mutationLogic,
        @JsonProperty("identity_logic") String identityLogic,
        @JsonProperty("statement") String statement,
        @JsonProperty("comment") String comment
) {

    public static RuleEntry from(RuleCandidate candidate) {
        String label = candidate.ruleLabel().isBlank()
                ? candidate.ruleKind().wireName()
                : candidate.ruleLabel();
        return new RuleEntry(
                candidate.wildType(),
                label,
                candidate.mutationDescriptor(),
                candidate.logicalExpression(),
                candidate.identityLogic(),
                candidate.statement(),
                candidate.comment()
        );
    }
}
