package com.claimrules.domain.extraction.model;

/**
 * A reference to a sequence listing entry found in claim text.
 *
 * @param identifier canonical identifier, e.g. {@code SEQ_ID_NO_2}
 * @param numericId  the listing number
 * @param context    surrounding claim text kept for provenance
 */
public record SequenceReference(String identifier, int numericId, String context) {

    public static final String IDENTIFIER_PREFIX = "SEQ_ID_NO_";

    public static SequenceReference of(int numericId, String context) {
        return new SequenceReference(IDENTIFIER_PREFIX + numericId, numericId, context == null ? "" : context);
    }
}
