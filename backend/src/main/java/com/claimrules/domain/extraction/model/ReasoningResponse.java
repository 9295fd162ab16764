package com.claimrules.domain.extraction.model;

/**
 * Raw reply of the reasoning capability including token usage.
 */
public record ReasoningResponse(String content, long promptTokens, long completionTokens) {}
