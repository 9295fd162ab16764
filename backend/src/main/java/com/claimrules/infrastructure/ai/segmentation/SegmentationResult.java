package com.claimrules.infrastructure.ai.segmentation;

import com.claimrules.domain.extraction.model.ClaimSegment;
import com.claimrules.domain.extraction.model.ProcessingLogEntry;

import java.util.List;

/**
 * Segments in claim-number order plus the slices that were dropped.
 */
public record SegmentationResult(List<ClaimSegment> segments, List<ProcessingLogEntry> issues) {

    public SegmentationResult {
        segments = List.copyOf(segments);
        issues = List.copyOf(issues);
    }

    public static SegmentationResult empty() {
        return new SegmentationResult(List.of(), List.of());
    }
}
