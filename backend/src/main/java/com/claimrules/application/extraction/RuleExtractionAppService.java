package com.claimrules.application.extraction;

import com.claimrules.domain.extraction.exception.InvalidPipelineConfigException;
import com.claimrules.domain.extraction.model.PipelineOptions;
import com.claimrules.domain.extraction.model.RuleEntry;
import com.claimrules.domain.extraction.model.RuleExtractionResult;
import com.claimrules.infrastructure.ai.ReasoningUsageTracker;
import com.claimrules.infrastructure.ai.pipeline.RuleExtractionPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RuleExtractionAppService {

    private final RuleExtractionPipeline extractionPipeline;
    private final ReasoningUsageTracker usageTracker;

    @Value("${extraction.max-claims-length:200000}")
    private int maxClaimsLength = 200_000;

    @Value("${chunking.max-batch-size:5}")
    private int defaultMaxBatchSize = 5;

    @Value("${chunking.complexity-budget:15.0}")
    private double defaultComplexityBudget = 15.0;

    @Value("${orchestrator.concurrency:4}")
    private int defaultConcurrency = 4;

    /**
     * Full extraction via pipeline. Null options fall back to configured defaults.
     */
    public RuleExtractionResult extract(String patentNumber,
                                        String group,
                                        String claimsText,
                                        List<RuleEntry> knownRules,
                                        Integer maxBatchSize,
                                        Double complexityBudget,
                                        Integer concurrency) {
        validateClaimsText(claimsText);

        PipelineOptions options = new PipelineOptions(
                maxBatchSize != null ? maxBatchSize : defaultMaxBatchSize,
                complexityBudget != null ? complexityBudget : defaultComplexityBudget,
                concurrency != null ? concurrency : defaultConcurrency);

        log.info("Extraction request - patent: {}, group: {}, textLength: {}, knownRules: {}, options: {}",
                patentNumber, group, claimsText.length(), knownRules == null ? 0 : knownRules.size(), options);

        return extractionPipeline.execute(patentNumber, group, claimsText, knownRules, options);
    }

    public void validateClaimsText(String claimsText) {
        if (claimsText != null && claimsText.length() > maxClaimsLength) {
            throw new InvalidPipelineConfigException(
                    String.format("Claims text must not exceed %d characters (got %d)", maxClaimsLength, claimsText.length()));
        }
    }

    public PipelineOptions defaultOptions() {
        return new PipelineOptions(defaultMaxBatchSize, defaultComplexityBudget, defaultConcurrency);
    }

    public int getMaxClaimsLength() {
        return maxClaimsLength;
    }

    public ReasoningUsageTracker getUsageTracker() {
        return usageTracker;
    }
}
