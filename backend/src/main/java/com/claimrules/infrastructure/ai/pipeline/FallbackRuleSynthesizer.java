package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.AnalysisBatch;
import com.claimrules.domain.extraction.model.BatchAnalysisOutcome;
import com.claimrules.domain.extraction.model.ClaimSegment;
import com.claimrules.domain.extraction.model.MutationCodes;
import com.claimrules.domain.extraction.model.ProcessingLogEntry.Stage;
import com.claimrules.domain.extraction.model.RuleCandidate;
import com.claimrules.domain.extraction.model.RuleKind;
import com.claimrules.domain.extraction.model.RuleProvenance;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Placeholder rules for a batch whose analysis failed: one needs-review rule per claim,
 * so no claim silently disappears from the output.
 */
@Component
public class FallbackRuleSynthesizer {

    static final String NEEDS_REVIEW_LABEL = "needs_review";
    static final String UNKNOWN_WILD_TYPE = "UNKNOWN";
    private static final int MAX_MUTATIONS = 5;

    public BatchAnalysisOutcome synthesize(AnalysisBatch batch, Stage failedStage, String reason, long elapsedMs) {
        List<RuleCandidate> placeholders = batch.segments().stream()
                .map(segment -> placeholderFor(batch.batchId(), segment, reason))
                .toList();

        return new BatchAnalysisOutcome(
                batch.batchId(),
                batch.claimNumbers(),
                0.0,
                placeholders,
                reason,
                elapsedMs,
                true,
                0,
                0,
                failedStage
        );
    }

    private RuleCandidate placeholderFor(int batchId, ClaimSegment segment, String reason) {
        String wildType = segment.sequenceIdentifiers().stream()
                .findFirst()
                .orElse(UNKNOWN_WILD_TYPE);
        String descriptor = MutationCodes.join(segment.mutationTokens().stream().limit(MAX_MUTATIONS).toList());

        return new RuleCandidate(
                wildType,
                RuleKind.UNKNOWN,
                NEEDS_REVIEW_LABEL,
                descriptor,
                "REVIEW(claim " + segment.claimNumber() + ")",
                "",
                "权利要求" + segment.claimNumber() + "需要人工审核",
                "needs review: " + reason,
                RuleProvenance.of(batchId, List.of(segment.claimNumber())),
                true
        );
    }
}
