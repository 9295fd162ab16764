package com.claimrules.interfaces.api.dto;

import com.claimrules.domain.extraction.model.RuleEntry;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

public record ExtractionRequest(
        @NotBlank(message = "Patent number is required")
        @Size(max = 64, message = "Patent number must not exceed 64 characters")
        String patentNumber,

        @Size(max = 64, message = "Group must not exceed 64 characters")
        String group,

        @NotBlank(message = "Claims text is required")
        String claimsText,

        List<RuleEntry> knownRules,

        @Positive(message = "maxBatchSize must be positive")
        Integer maxBatchSize,

        @Positive(message = "complexityBudget must be positive")
        Double complexityBudget,

        @Positive(message = "concurrency must be positive")
        Integer concurrency
) {}
