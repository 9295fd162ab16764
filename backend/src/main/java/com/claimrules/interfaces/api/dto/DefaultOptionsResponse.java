package com.claimrules.interfaces.api.dto;

public record DefaultOptionsResponse(
        int maxBatchSize,
        double complexityBudget,
        int concurrency,
        int maxClaimsLength
) {}
