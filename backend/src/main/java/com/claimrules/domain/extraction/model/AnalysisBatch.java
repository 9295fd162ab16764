package com.claimrules.domain.extraction.model;

import java.util.List;

/**
 * A group of claim segments analyzed together in one reasoning call.
 * Batch ids start at 1 and follow creation order.
 */
public record AnalysisBatch(int batchId, List<ClaimSegment> segments) {

    public AnalysisBatch {
        if (batchId <= 0) {
            throw new IllegalArgumentException("Batch id must be positive: " + batchId);
        }
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("Batch " + batchId + " has no segments");
        }
        segments = List.copyOf(segments);
    }

    /**
     * Single batch holding every segment of a document (single-pass mode).
     * Not bound by the batch size or complexity budget.
     */
    public static AnalysisBatch wholeDocument(List<ClaimSegment> segments) {
        return new AnalysisBatch(1, segments);
    }

    public int size() {
        return segments.size();
    }

    public List<Integer> claimNumbers() {
        return segments.stream().map(ClaimSegment::claimNumber).toList();
    }

    public double totalComplexity() {
        return segments.stream().mapToDouble(ClaimSegment::complexityScore).sum();
    }

    public double minComplexity() {
        return segments.stream().mapToDouble(ClaimSegment::complexityScore).min().orElse(0.0);
    }

    public double maxComplexity() {
        return segments.stream().mapToDouble(ClaimSegment::complexityScore).max().orElse(0.0);
    }

    public long independentCount() {
        return segments.stream().filter(s -> !s.isDependent()).count();
    }

    public long dependentCount() {
        return segments.stream().filter(ClaimSegment::isDependent).count();
    }
}
