package com.claimrules.domain.extraction.model;

import java.util.Locale;

/**
 * Category of a protection rule, parsed from the free-form label the model emits.
 */
public enum RuleKind {
    IDENTICAL("identical", 10.0),
    IDENTITY_THRESHOLD("identity_threshold", 8.0),
    CONDITIONAL("conditional", 6.0),
    UNKNOWN("unknown", 3.0);

    private final String wireName;
    private final double priorityWeight;

    RuleKind(String wireName, double priorityWeight) {
        this.wireName = wireName;
        this.priorityWeight = priorityWeight;
    }

    public String wireName() {
        return wireName;
    }

    public double priorityWeight() {
        return priorityWeight;
    }

    /**
     * Maps labels such as {@code "identical"}, {@code "identity>70%"} or {@code "conditional"}.
     * Order matters: "identical" is checked before "identity".
     */
    public static RuleKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        String normalized = label.toLowerCase(Locale.ROOT);
        if (normalized.contains("identical")) {
            return IDENTICAL;
        }
        if (normalized.contains("identity")) {
            return IDENTITY_THRESHOLD;
        }
        if (normalized.contains("conditional")) {
            return CONDITIONAL;
        }
        return UNKNOWN;
    }
}
