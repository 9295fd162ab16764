package com.claimrules.domain.extraction.model;

import com.claimrules.domain.extraction.exception.InvalidPipelineConfigException;

/**
 * Per-run chunking and concurrency settings. Validated on construction so that a
 * bad value fails before any claim is processed.
 */
public record PipelineOptions(int maxBatchSize, double complexityBudget, int concurrency) {

    public PipelineOptions {
        if (maxBatchSize <= 0) {
            throw new InvalidPipelineConfigException("maxBatchSize must be positive: " + maxBatchSize);
        }
        if (Double.isNaN(complexityBudget) || complexityBudget <= 0) {
            throw new InvalidPipelineConfigException("complexityBudget must be positive: " + complexityBudget);
        }
        if (concurrency <= 0) {
            throw new InvalidPipelineConfigException("concurrency must be positive: " + concurrency);
        }
    }
}
