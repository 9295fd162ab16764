package com.claimrules.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide counters for reasoning calls and token usage.
 * Exposed through {@code GET /api/v1/extractions/usage}.
 */
@Slf4j
@Component
public class ReasoningUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void recordUsage(long promptTokens, long completionTokens) {
        totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        log.debug("[Reasoning] request #{}: promptTokens={}, completionTokens={}, cumulative prompt={}, completion={}",
                totalRequests.get(), promptTokens, completionTokens,
                totalPromptTokens.get(), totalCompletionTokens.get());
    }

    public void recordFailure() {
        totalRequests.incrementAndGet();
        long failed = failedRequests.incrementAndGet();
        log.debug("[Reasoning] failed requests so far: {} ({}%)", failed, String.format("%.1f", getFailureRate()));
    }

    public double getFailureRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) failedRequests.get() / total * 100 : 0;
    }

    public long getFailedRequests() {
        return failedRequests.get();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalPromptTokens() {
        return totalPromptTokens.get();
    }

    public long getTotalCompletionTokens() {
        return totalCompletionTokens.get();
    }
}
