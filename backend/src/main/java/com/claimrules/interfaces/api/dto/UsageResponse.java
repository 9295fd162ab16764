package com.claimrules.interfaces.api.dto;

/**
 * Cumulative reasoning usage since startup. {@code failureRate} is a percentage.
 */
public record UsageResponse(
        long totalRequests,
        long failedRequests,
        double failureRate,
        long promptTokens,
        long completionTokens
) {}
