package com.claimrules.domain.extraction.model;

public record QualityMetrics(
        double averageQuality,
        int highQualityCount,
        int lowQualityCount,
        double rulesPerClaim,
        int uniqueWildTypes,
        int rulesWithLogic
) {

    public static QualityMetrics empty() {
        return new QualityMetrics(0.0, 0, 0, 0.0, 0, 0);
    }
}
