package com.claimrules.infrastructure.ai.chunking;

import com.claimrules.domain.extraction.exception.InvalidPipelineConfigException;
import com.claimrules.domain.extraction.model.AnalysisBatch;
import com.claimrules.domain.extraction.model.ClaimSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups claim segments into batches bounded by size and cumulative complexity.
 * <p>
 * Segments are walked tier by tier (LOW, MODERATE, HIGH), input order kept within a tier.
 * The open batch is closed before appending when it already holds {@code maxBatchSize}
 * segments or when the segment would push its complexity over {@code complexityBudget}.
 * The open batch carries over tier boundaries. A segment whose own score exceeds the
 * budget ends up alone in its batch. Same input and thresholds give the same batches.
 * </p>
 */
@Slf4j
@Component
public class ChunkBuilder {

    public List<AnalysisBatch> build(List<ClaimSegment> segments, int maxBatchSize, double complexityBudget) {
        validate(maxBatchSize, complexityBudget);
        if (segments == null || segments.isEmpty()) {
            return List.of();
        }
        requireUniqueClaimNumbers(segments);

        Map<ComplexityTier, List<ClaimSegment>> tiers = stratify(segments);

        List<AnalysisBatch> batches = new ArrayList<>();
        List<ClaimSegment> current = new ArrayList<>();
        double currentComplexity = 0.0;

        for (ComplexityTier tier : ComplexityTier.values()) {
            for (ClaimSegment segment : tiers.get(tier)) {
                boolean full = current.size() >= maxBatchSize;
                boolean overBudget = currentComplexity + segment.complexityScore() > complexityBudget;
                if (!current.isEmpty() && (full || overBudget)) {
                    batches.add(new AnalysisBatch(batches.size() + 1, current));
                    current = new ArrayList<>();
                    currentComplexity = 0.0;
                }
                current.add(segment);
                currentComplexity += segment.complexityScore();
            }
        }
        if (!current.isEmpty()) {
            batches.add(new AnalysisBatch(batches.size() + 1, current));
        }

        log.info("[ChunkBuilder] {} segments -> {} batches (maxBatchSize={}, budget={}, tiers: low={}, moderate={}, high={})",
                segments.size(), batches.size(), maxBatchSize, complexityBudget,
                tiers.get(ComplexityTier.LOW).size(),
                tiers.get(ComplexityTier.MODERATE).size(),
                tiers.get(ComplexityTier.HIGH).size());
        return batches;
    }

    // ===== Internal methods =====

    private void validate(int maxBatchSize, double complexityBudget) {
        if (maxBatchSize <= 0) {
            throw new InvalidPipelineConfigException("maxBatchSize must be positive: " + maxBatchSize);
        }
        if (Double.isNaN(complexityBudget) || complexityBudget <= 0) {
            throw new InvalidPipelineConfigException("complexityBudget must be positive: " + complexityBudget);
        }
    }

    private void requireUniqueClaimNumbers(List<ClaimSegment> segments) {
        Set<Integer> seen = new HashSet<>();
        for (ClaimSegment segment : segments) {
            if (!seen.add(segment.claimNumber())) {
                throw new IllegalArgumentException("Duplicate claim number: " + segment.claimNumber());
            }
        }
    }

    private Map<ComplexityTier, List<ClaimSegment>> stratify(List<ClaimSegment> segments) {
        Map<ComplexityTier, List<ClaimSegment>> tiers = new EnumMap<>(ComplexityTier.class);
        for (ComplexityTier tier : ComplexityTier.values()) {
            tiers.put(tier, new ArrayList<>());
        }
        for (ClaimSegment segment : segments) {
            tiers.get(ComplexityTier.of(segment.complexityScore())).add(segment);
        }
        return tiers;
    }
}
