package com.claimrules.domain.extraction.model;

public record MergedRule(RuleCandidate candidate, double priorityScore, double qualityScore) {}
