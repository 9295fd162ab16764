package com.claimrules.infrastructure.ai;

import com.claimrules.domain.extraction.model.AnalysisBatch;
import com.claimrules.domain.extraction.model.ClaimSegment;
import com.claimrules.domain.extraction.model.ReasoningPrompt;
import com.claimrules.domain.extraction.model.RuleEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the system prompt and per-batch user message for rule extraction.
 * Claims are serialized as JSON with provenance windows and offsets left out.
 */
@Component
@RequiredArgsConstructor
public class BatchPromptBuilder {

    private final ObjectMapper objectMapper;

    @Value("${orchestrator.calibration-sample-size:3}")
    private int calibrationSampleSize = 3;

    // ===== Payload shapes =====

    record ClaimPayload(
            @JsonProperty("claim_number") int claimNumber,
            @JsonProperty("claim_type") String claimType,
            @JsonProperty("text") String text,
            @JsonProperty("dependencies") Set<Integer> dependencies,
            @JsonProperty("seq_id_references") List<String> seqIdReferences,
            @JsonProperty("mutations") Set<String> mutations,
            @JsonProperty("complexity_score") double complexityScore
    ) {}

    record BatchSummary(
            @JsonProperty("batch_id") int batchId,
            @JsonProperty("total_claims") int totalClaims,
            @JsonProperty("complexity_range") double[] complexityRange,
            @JsonProperty("seq_id_count") long seqIdCount,
            @JsonProperty("independent_claims") long independentClaims,
            @JsonProperty("dependent_claims") long dependentClaims
    ) {}

    record BatchPayload(
            @JsonProperty("batch_summary") BatchSummary batchSummary,
            @JsonProperty("claims") List<ClaimPayload> claims
    ) {}

    // ===== System prompt =====

    private static final String SYSTEM_PROMPT = """
            你是专利序列保护分析专家。你的任务是从权利要求中提取结构化的保护规则。

            ## 分析要求
            1. **保护范围识别**
               - 野生型序列标识 (wild_type)，统一写作 SEQ_ID_NO_<编号>
               - 保护类型 (rule): identical / identity>X% / conditional
               - 突变模式: 突变写作 原氨基酸+位置+新氨基酸，例如 Y178A；多个突变用 / 连接
            2. **逻辑表达式生成**
               - 用 & 表示同时存在，| 表示任选其一，! 表示排除，括号表示分组
               - 例如: (W46E&Q62W)|Y178A
            3. **从属关系**: 从属权利要求继承其引用权利要求的限定，只输出新增的限定

            ## 输出格式 (严格遵守)
            只输出 JSON，不要输出任何解释：
            {"rules": [{"claim_number": 1, "wild_type": "SEQ_ID_NO_1", "rule": "identity>90%",
              "mutation": "W46E/Q62W", "mutation_logic": "W46E&Q62W", "identity_logic": ">90%",
              "statement": "与SEQ ID NO:1具有至少90%同一性且包含W46E和Q62W突变的多肽", "comment": ""}]}
            """;

    public String getSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Prompt for one batch, with up to {@code calibrationSampleSize} known rules as examples.
     */
    public ReasoningPrompt build(AnalysisBatch batch, List<RuleEntry> knownRules) {
        StringBuilder sb = new StringBuilder();

        sb.append("## 当前分析块特征\n");
        sb.append("- 块编号: ").append(batch.batchId()).append('\n');
        sb.append("- 权利要求编号: ").append(batch.claimNumbers()).append('\n');
        sb.append("- 平均复杂度: ").append(String.format(Locale.ROOT, "%.2f", batch.totalComplexity() / batch.size())).append('\n');
        sb.append("- 独立权利要求: ").append(batch.independentCount()).append("个\n");
        sb.append("- 从属权利要求: ").append(batch.dependentCount()).append("个\n\n");

        List<RuleEntry> sample = knownRules == null ? List.of()
                : knownRules.stream().limit(Math.max(calibrationSampleSize, 0)).toList();
        if (!sample.isEmpty()) {
            sb.append("## 参考规则示例\n");
            sb.append(toJson(sample)).append("\n\n");
        }

        sb.append("## 权利要求数据\n");
        sb.append(toJson(toPayload(batch))).append("\n\n");
        sb.append("请为每个权利要求提取保护规则，按上述 JSON 格式输出。");

        return new ReasoningPrompt(SYSTEM_PROMPT, sb.toString());
    }

    // ===== Internal methods =====

    BatchPayload toPayload(AnalysisBatch batch) {
        List<ClaimPayload> claims = batch.segments().stream()
                .map(this::toClaimPayload)
                .toList();

        long seqIdCount = batch.segments().stream()
                .flatMap(s -> s.sequenceIdentifiers().stream())
                .distinct()
                .count();

        BatchSummary summary = new BatchSummary(
                batch.batchId(),
                batch.size(),
                new double[]{batch.minComplexity(), batch.maxComplexity()},
                seqIdCount,
                batch.independentCount(),
                batch.dependentCount()
        );
        return new BatchPayload(summary, claims);
    }

    private ClaimPayload toClaimPayload(ClaimSegment segment) {
        return new ClaimPayload(
                segment.claimNumber(),
                segment.claimKind().name().toLowerCase(Locale.ROOT),
                segment.rawText(),
                segment.dependencyRefs(),
                segment.sequenceIdentifiers(),
                segment.mutationTokens(),
                segment.complexityScore()
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ReasoningCallException("Failed to serialize prompt payload", e);
        }
    }
}
