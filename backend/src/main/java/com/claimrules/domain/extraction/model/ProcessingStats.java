package com.claimrules.domain.extraction.model;

import java.util.List;

/**
 * Timing and throughput over all batches of one run. Times are summed per batch,
 * so with concurrent batches {@code totalProcessingMs} exceeds wall time.
 */
public record ProcessingStats(
        long totalProcessingMs,
        double averageBatchMs,
        long minBatchMs,
        long maxBatchMs,
        double claimsPerSecond,
        double rulesPerSecond,
        int errorCount,
        List<String> errorMessages,
        long promptTokens,
        long completionTokens
) {

    public ProcessingStats {
        errorMessages = errorMessages == null ? List.of() : List.copyOf(errorMessages);
    }

    public static ProcessingStats empty() {
        return new ProcessingStats(0, 0.0, 0, 0, 0.0, 0.0, 0, List.of(), 0, 0);
    }
}
