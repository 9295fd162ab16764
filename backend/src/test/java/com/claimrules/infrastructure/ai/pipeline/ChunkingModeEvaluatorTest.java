package com.claimrules.infrastructure.ai.pipeline;

import com.claimrules.domain.extraction.model.AnalysisMode;
import com.claimrules.domain.extraction.model.ClaimKind;
import com.claimrules.domain.extraction.model.ClaimSegment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkingModeEvaluatorTest {

    private final ChunkingModeEvaluator evaluator = new ChunkingModeEvaluator();

    private static List<ClaimSegment> claims(int count, int lengthEach) {
        return claims(count, lengthEach, Set.of());
    }

    private static List<ClaimSegment> claims(int count, int lengthEach, Set<Integer> refs) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(n -> new ClaimSegment(n, "x".repeat(lengthEach), ClaimKind.INDEPENDENT,
                        refs, List.of(), Set.of(), 1.0))
                .toList();
    }

    @Test
    @DisplayName("12 claims totalling 12,000 chars → CHUNKED")
    void many_long_claims() {
        assertThat(evaluator.decide(claims(12, 1_000))).isEqualTo(AnalysisMode.CHUNKED);
    }

    @Test
    @DisplayName("8 claims totalling 12,000 chars → CHUNKED on length")
    void long_text() {
        assertThat(evaluator.decide(claims(8, 1_500))).isEqualTo(AnalysisMode.CHUNKED);
    }

    @Test
    @DisplayName("11 short claims → CHUNKED on count")
    void many_claims() {
        assertThat(evaluator.decide(claims(11, 50))).isEqualTo(AnalysisMode.CHUNKED);
    }

    @Test
    @DisplayName("6 claims totalling 6,000 chars → CHUNKED on the combined rule")
    void combined_rule() {
        assertThat(evaluator.decide(claims(6, 1_000))).isEqualTo(AnalysisMode.CHUNKED);
    }

    @Test
    @DisplayName("5 claims totalling 6,000 chars → SINGLE_PASS")
    void combined_rule_needs_both() {
        assertThat(evaluator.decide(claims(5, 1_200))).isEqualTo(AnalysisMode.SINGLE_PASS);
    }

    @Test
    @DisplayName("More than 20 dependency references → CHUNKED")
    void dependency_heavy() {
        Set<Integer> refs = Set.of(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(evaluator.decide(claims(3, 100, refs))).isEqualTo(AnalysisMode.CHUNKED);
    }

    @Test
    @DisplayName("Small document → SINGLE_PASS")
    void small_document() {
        assertThat(evaluator.decide(claims(3, 100))).isEqualTo(AnalysisMode.SINGLE_PASS);
    }
}
