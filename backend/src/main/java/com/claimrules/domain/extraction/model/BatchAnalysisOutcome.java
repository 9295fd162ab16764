package com.claimrules.domain.extraction.model;

import java.util.List;

/**
 * Result of analyzing one batch. Always present, even when the batch failed.
 *
 * @param batchId          batch this outcome belongs to
 * @param claimNumbers     claims in the batch
 * @param confidence       heuristic confidence in [0, 1]
 * @param ruleCandidates   extracted rules, or placeholders when {@code fallbackUsed}
 * @param errorMessage     failure reason (nullable)
 * @param processingTimeMs wall time spent on the batch
 * @param fallbackUsed     true if the candidates are synthesized placeholders
 * @param promptTokens     prompt tokens reported by the reasoning call
 * @param completionTokens completion tokens reported by the reasoning call
 * @param failureStage     stage that failed when {@code fallbackUsed} (nullable)
 */
public record BatchAnalysisOutcome(
        int batchId,
        List<Integer> claimNumbers,
        double confidence,
        List<RuleCandidate> ruleCandidates,
        String errorMessage,
        long processingTimeMs,
        boolean fallbackUsed,
        long promptTokens,
        long completionTokens,
        ProcessingLogEntry.Stage failureStage
) {

    public BatchAnalysisOutcome {
        claimNumbers = claimNumbers == null ? List.of() : List.copyOf(claimNumbers);
        ruleCandidates = ruleCandidates == null ? List.of() : List.copyOf(ruleCandidates);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public boolean succeeded() {
        return !fallbackUsed && errorMessage == null;
    }
}
