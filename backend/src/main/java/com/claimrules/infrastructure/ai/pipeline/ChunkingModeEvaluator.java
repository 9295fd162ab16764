package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.AnalysisMode;
import com.claimrules.domain.extraction.model.ClaimSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides between single-pass and chunked analysis.
 */
@Slf4j
@Component
public class ChunkingModeEvaluator {

    @Value("${chunking.mode.max-text-length:10000}")
    private int maxTextLength = 10_000;

    @Value("${chunking.mode.max-claim-count:10}")
    private int maxClaimCount = 10;

    @Value("${chunking.mode.combined-text-length:5000}")
    private int combinedTextLength = 5_000;

    @Value("${chunking.mode.combined-claim-count:5}")
    private int combinedClaimCount = 5;

    @Value("${chunking.mode.max-dependency-refs:20}")
    private int maxDependencyRefs = 20;

    /**
     * CHUNKED conditions (any true):
     *   1. total claim text length &gt; 10,000
     *   2. claim count &gt; 10
     *   3. length &gt; 5,000 AND count &gt; 5
     *   4. total cross-claim dependency references &gt; 20
     */
    public AnalysisMode decide(List<ClaimSegment> segments) {
        int totalLength = segments.stream().mapToInt(ClaimSegment::length).sum();
        int claimCount = segments.size();
        int dependencyRefs = segments.stream().mapToInt(s -> s.dependencyRefs().size()).sum();

        if (totalLength > maxTextLength) {
            log.info("[ModeDecision] CHUNKED (text length {} > {})", totalLength, maxTextLength);
            return AnalysisMode.CHUNKED;
        }
        if (claimCount > maxClaimCount) {
            log.info("[ModeDecision] CHUNKED (claim count {} > {})", claimCount, maxClaimCount);
            return AnalysisMode.CHUNKED;
        }
        if (totalLength > combinedTextLength && claimCount > combinedClaimCount) {
            log.info("[ModeDecision] CHUNKED (length {} > {} and count {} > {})",
                    totalLength, combinedTextLength, claimCount, combinedClaimCount);
            return AnalysisMode.CHUNKED;
        }
        if (dependencyRefs > maxDependencyRefs) {
            log.info("[ModeDecision] CHUNKED (dependency references {} > {})", dependencyRefs, maxDependencyRefs);
            return AnalysisMode.CHUNKED;
        }

        log.info("[ModeDecision] SINGLE_PASS (length={}, claims={}, refs={})", totalLength, claimCount, dependencyRefs);
        return AnalysisMode.SINGLE_PASS;
    }
}
