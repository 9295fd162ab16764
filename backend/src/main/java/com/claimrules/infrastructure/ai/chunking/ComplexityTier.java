package com.claimrules.infrastructure.ai.chunking;

/**
 * Complexity strata used to order batch construction: LOW (&lt;3), MODERATE (3..6), HIGH (&gt;6).
 */
public enum ComplexityTier {
    LOW,
    MODERATE,
    HIGH;

    public static ComplexityTier of(double complexityScore) {
        if (complexityScore < 3.0) {
            return LOW;
        }
        if (complexityScore <= 6.0) {
            return MODERATE;
        }
        return HIGH;
    }
}
