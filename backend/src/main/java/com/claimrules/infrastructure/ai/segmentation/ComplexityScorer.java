package com.claimrules.infrastructure.ai.segmentation;

import com.claimrules.domain.extraction.exception.InvalidPipelineConfigException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Weighted complexity score of a claim, used to bound batch workload.
 * <pre>
 * score = 1.0 + min(length / lengthDivisor, lengthCap)
 *       + referenceWeight * #sequenceRefs
 *       + mutationWeight * #mutations
 *       + connectiveWeight * #connectives
 *       + percentageWeight * #percentages
 * </pre>
 * clamped to [1.0, 10.0]. Weights must be non-negative so the score never decreases
 * when a feature count grows.
 */
@Slf4j
@Component
public class ComplexityScorer {

    public static final double MIN_SCORE = 1.0;
    public static final double MAX_SCORE = 10.0;

    @Value("${segmenter.complexity.length-divisor:500}")
    private double lengthDivisor = 500;

    @Value("${segmenter.complexity.length-cap:3.0}")
    private double lengthCap = 3.0;

    @Value("${segmenter.complexity.reference-weight:0.1}")
    private double referenceWeight = 0.1;

    @Value("${segmenter.complexity.mutation-weight:0.2}")
    private double mutationWeight = 0.2;

    @Value("${segmenter.complexity.connective-weight:0.1}")
    private double connectiveWeight = 0.1;

    @Value("${segmenter.complexity.percentage-weight:0.1}")
    private double percentageWeight = 0.1;

    @PostConstruct
    void validateWeights() {
        if (!(lengthDivisor > 0)) {
            throw new InvalidPipelineConfigException("segmenter.complexity.length-divisor must be positive: " + lengthDivisor);
        }
        requireNonNegative("length-cap", lengthCap);
        requireNonNegative("reference-weight", referenceWeight);
        requireNonNegative("mutation-weight", mutationWeight);
        requireNonNegative("connective-weight", connectiveWeight);
        requireNonNegative("percentage-weight", percentageWeight);
        log.info("[Segmenter] Complexity weights: divisor={}, cap={}, ref={}, mutation={}, connective={}, percent={}",
                lengthDivisor, lengthCap, referenceWeight, mutationWeight, connectiveWeight, percentageWeight);
    }

    public double score(int textLength, int sequenceRefCount, int mutationCount,
                        int connectiveCount, int percentageCount) {
        double score = MIN_SCORE
                + Math.min(textLength / lengthDivisor, lengthCap)
                + referenceWeight * sequenceRefCount
                + mutationWeight * mutationCount
                + connectiveWeight * connectiveCount
                + percentageWeight * percentageCount;
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    private void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new InvalidPipelineConfigException("segmenter.complexity." + name + " must be non-negative: " + value);
        }
    }
}
