package com.claimrules.infrastructure.ai.segmentation;

/**
 * A typed span of claim text produced by {@link ClaimTokenizer}.
 */
public record ClaimToken(Type type, String text, int start, int end) {

    /**
     * Token types in match priority order.
     */
    public enum Type {
        CLAIM_REFERENCE,
        SEQUENCE_REFERENCE,
        MUTATION,
        PERCENTAGE,
        CONNECTIVE
    }
}
