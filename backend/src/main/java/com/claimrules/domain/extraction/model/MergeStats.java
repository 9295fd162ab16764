package com.claimrules.domain.extraction.model;

public record MergeStats(
        int candidatesBeforeMerge,
        int exactDuplicatesRemoved,
        int similarityMerges,
        int rulesAfterMerge
) {}
