package com.claimrules.infrastructure.ai.merge;

import com.claimrules.domain.extraction.model.BatchAnalysisOutcome;
import com.claimrules.domain.extraction.model.LogicalExpressions;
import com.claimrules.domain.extraction.model.MergeStats;
import com.claimrules.domain.extraction.model.MergedRule;
import com.claimrules.domain.extraction.model.MergedRuleSet;
import com.claimrules.domain.extraction.model.MutationCodes;
import com.claimrules.domain.extraction.model.RuleCandidate;
import com.claimrules.domain.extraction.model.RuleProvenance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reconciles the rule candidates of all batches into one rule set.
 * <p>
 * exact dedup → similarity merge → dedup again → quality + priority → sort
 * </p>
 * Similarity merge is seed-based within a wild type: the first unassigned candidate seeds
 * a cluster and every later candidate of the same kind whose mutation set overlaps the
 * seed's by more than the threshold (Jaccard) joins it. Placeholders and candidates without
 * mutations are never merged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleMerger {

    private static final double MUTATION_BONUS_CAP = 3.0;
    private static final double OPERATOR_BONUS_CAP = 2.0;
    private static final int DETAILED_STATEMENT_LENGTH = 30;

    private final RuleQualityEvaluator qualityEvaluator;
    private final MergeMetricsCalculator metricsCalculator;

    @Value("${merger.similarity-threshold:0.6}")
    private double similarityThreshold = 0.6;

    public MergedRuleSet merge(List<BatchAnalysisOutcome> outcomes) {
        List<BatchAnalysisOutcome> ordered = outcomes.stream()
                .sorted(Comparator.comparingInt(BatchAnalysisOutcome::batchId))
                .toList();

        List<RuleCandidate> all = ordered.stream()
                .flatMap(o -> o.ruleCandidates().stream())
                .toList();

        // 1. Exact dedup
        SignatureIndex index = SignatureIndex.of(all);
        List<RuleCandidate> unique = index.values();

        // 2. Similarity merge
        List<RuleCandidate> merged = mergeSimilar(unique);
        int similarityMerges = unique.size() - merged.size();

        // 3. Merged rules may now collide with an existing signature
        SignatureIndex finalIndex = SignatureIndex.of(merged);
        List<RuleCandidate> survivors = finalIndex.values();

        // 4. Score and order
        List<MergedRule> rules = survivors.stream()
                .map(c -> new MergedRule(c, priorityOf(c), qualityEvaluator.evaluate(c)))
                .sorted(Comparator.comparingDouble(MergedRule::priorityScore).reversed())
                .toList();

        Set<Integer> analyzedClaims = new TreeSet<>();
        ordered.forEach(o -> analyzedClaims.addAll(o.claimNumbers()));
        double completeness = completeness(rules, analyzedClaims);

        MergeStats mergeStats = new MergeStats(
                all.size(),
                index.duplicatesRemoved() + finalIndex.duplicatesRemoved(),
                similarityMerges,
                rules.size());

        log.info("[Merger] {} candidates -> {} rules (duplicates={}, similarity merges={}), completeness={}",
                all.size(), rules.size(), mergeStats.exactDuplicatesRemoved(), similarityMerges,
                String.format("%.2f", completeness));

        return new MergedRuleSet(
                rules,
                completeness,
                metricsCalculator.qualityMetrics(rules, analyzedClaims.size()),
                metricsCalculator.processingStats(ordered, analyzedClaims.size(), rules.size()),
                metricsCalculator.analysisSummary(ordered, rules),
                mergeStats
        );
    }

    /**
     * typeWeight + min(0.5 * mutations, 3) + min(0.2 * operators, 2) + (statement &gt; 30 chars ? 1 : 0)
     */
    double priorityOf(RuleCandidate candidate) {
        double priority = candidate.ruleKind().priorityWeight();
        priority += Math.min(0.5 * candidate.mutationCount(), MUTATION_BONUS_CAP);
        priority += Math.min(0.2 * LogicalExpressions.countOperators(candidate.logicalExpression()), OPERATOR_BONUS_CAP);
        if (candidate.statement().length() > DETAILED_STATEMENT_LENGTH) {
            priority += 1.0;
        }
        return priority;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    // ===== Internal methods =====

    private List<RuleCandidate> mergeSimilar(List<RuleCandidate> candidates) {
        Map<String, List<RuleCandidate>> byWildType = new LinkedHashMap<>();
        for (RuleCandidate candidate : candidates) {
            byWildType.computeIfAbsent(candidate.wildType(), k -> new ArrayList<>()).add(candidate);
        }

        List<RuleCandidate> result = new ArrayList<>();
        for (List<RuleCandidate> group : byWildType.values()) {
            boolean[] assigned = new boolean[group.size()];
            for (int i = 0; i < group.size(); i++) {
                if (assigned[i]) {
                    continue;
                }
                assigned[i] = true;
                RuleCandidate seed = group.get(i);
                List<RuleCandidate> cluster = new ArrayList<>();
                cluster.add(seed);

                if (isMergeable(seed)) {
                    Set<String> seedMutations = seed.mutationSet();
                    for (int j = i + 1; j < group.size(); j++) {
                        RuleCandidate other = group.get(j);
                        if (!assigned[j] && isMergeable(other)
                                && other.ruleKind() == seed.ruleKind()
                                && jaccard(seedMutations, other.mutationSet()) > similarityThreshold) {
                            cluster.add(other);
                            assigned[j] = true;
                        }
                    }
                }
                result.add(cluster.size() > 1 ? combine(cluster) : seed);
            }
        }
        return result;
    }

    private boolean isMergeable(RuleCandidate candidate) {
        return !candidate.needsReview() && !candidate.mutationSet().isEmpty();
    }

    private RuleCandidate combine(List<RuleCandidate> cluster) {
        RuleCandidate first = cluster.get(0);

        Set<String> codes = new TreeSet<>();
        Set<String> expressions = new LinkedHashSet<>();
        RuleProvenance provenance = first.provenance();
        for (RuleCandidate member : cluster) {
            codes.addAll(member.mutationSet());
            if (!member.logicalExpression().isBlank()) {
                expressions.add(member.logicalExpression());
            }
            provenance = provenance.merge(member.provenance());
        }

        String expression = expressions.size() <= 1
                ? String.join("", expressions)
                : String.join(" | ", expressions.stream().map(e -> "(" + e + ")").toList());

        log.debug("[Merger] Merged {} rules on {} into {}", cluster.size(), first.wildType(), MutationCodes.join(codes));
        return first.withMergedContent(
                MutationCodes.join(codes),
                expression,
                "merged " + cluster.size() + " similar rules",
                provenance);
    }

    private double completeness(List<MergedRule> rules, Set<Integer> analyzedClaims) {
        if (analyzedClaims.isEmpty()) {
            return 0.0;
        }
        Set<Integer> covered = new HashSet<>();
        for (MergedRule rule : rules) {
            if (!rule.candidate().needsReview()) {
                covered.addAll(rule.candidate().provenance().claimNumbers());
            }
        }
        covered.retainAll(analyzedClaims);
        return (double) covered.size() / analyzedClaims.size();
    }
}
