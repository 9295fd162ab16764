package com.claimrules.infrastructure.ai.merge;

import com.claimrules.domain.extraction.model.AnalysisSummary;
import com.claimrules.domain.extraction.model.BatchAnalysisOutcome;
import com.claimrules.domain.extraction.model.MergedRule;
import com.claimrules.domain.extraction.model.ProcessingStats;
import com.claimrules.domain.extraction.model.QualityMetrics;
import com.claimrules.domain.extraction.model.RuleCandidate;
import com.claimrules.domain.extraction.model.RuleKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Run-level metrics derived from batch outcomes and the merged rules.
 */
@Component
public class MergeMetricsCalculator {

    static final double HIGH_QUALITY = 0.8;
    static final double LOW_QUALITY = 0.5;

    public ProcessingStats processingStats(List<BatchAnalysisOutcome> outcomes, int claimsAnalyzed, int ruleCount) {
        if (outcomes.isEmpty()) {
            return ProcessingStats.empty();
        }

        long total = outcomes.stream().mapToLong(BatchAnalysisOutcome::processingTimeMs).sum();
        long min = outcomes.stream().mapToLong(BatchAnalysisOutcome::processingTimeMs).min().orElse(0);
        long max = outcomes.stream().mapToLong(BatchAnalysisOutcome::processingTimeMs).max().orElse(0);
        double seconds = total / 1000.0;

        List<String> errors = outcomes.stream()
                .map(BatchAnalysisOutcome::errorMessage)
                .filter(Objects::nonNull)
                .toList();

        return new ProcessingStats(
                total,
                (double) total / outcomes.size(),
                min,
                max,
                seconds > 0 ? claimsAnalyzed / seconds : 0.0,
                seconds > 0 ? ruleCount / seconds : 0.0,
                errors.size(),
                errors,
                outcomes.stream().mapToLong(BatchAnalysisOutcome::promptTokens).sum(),
                outcomes.stream().mapToLong(BatchAnalysisOutcome::completionTokens).sum()
        );
    }

    public QualityMetrics qualityMetrics(List<MergedRule> rules, int claimsAnalyzed) {
        if (rules.isEmpty()) {
            return QualityMetrics.empty();
        }

        double average = rules.stream().mapToDouble(MergedRule::qualityScore).average().orElse(0.0);
        int high = (int) rules.stream().filter(r -> r.qualityScore() > HIGH_QUALITY).count();
        int low = (int) rules.stream().filter(r -> r.qualityScore() < LOW_QUALITY).count();
        int wildTypes = (int) rules.stream().map(r -> r.candidate().wildType()).distinct().count();
        int withLogic = (int) rules.stream().filter(r -> !r.candidate().logicalExpression().isBlank()).count();

        return new QualityMetrics(
                average,
                high,
                low,
                claimsAnalyzed > 0 ? (double) rules.size() / claimsAnalyzed : 0.0,
                wildTypes,
                withLogic
        );
    }

    public AnalysisSummary analysisSummary(List<BatchAnalysisOutcome> outcomes, List<MergedRule> rules) {
        int total = outcomes.size();
        int successful = (int) outcomes.stream().filter(BatchAnalysisOutcome::succeeded).count();

        Map<RuleKind, Integer> kindCounts = new EnumMap<>(RuleKind.class);
        for (MergedRule rule : rules) {
            kindCounts.merge(rule.candidate().ruleKind(), 1, Integer::sum);
        }

        List<String> wildTypes = rules.stream()
                .map(MergedRule::candidate)
                .filter(c -> !c.needsReview())
                .map(RuleCandidate::wildType)
                .filter(w -> !w.isBlank())
                .distinct()
                .sorted()
                .toList();

        double averageConfidence = outcomes.stream()
                .filter(BatchAnalysisOutcome::succeeded)
                .mapToDouble(BatchAnalysisOutcome::confidence)
                .average()
                .orElse(0.0);

        return new AnalysisSummary(
                total,
                successful,
                total - successful,
                total > 0 ? (double) successful / total : 0.0,
                kindCounts,
                wildTypes,
                averageConfidence
        );
    }
}
