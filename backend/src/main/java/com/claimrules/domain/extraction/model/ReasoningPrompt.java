package com.claimrules.domain.extraction.model;

public record ReasoningPrompt(String systemPrompt, String userMessage) {}
