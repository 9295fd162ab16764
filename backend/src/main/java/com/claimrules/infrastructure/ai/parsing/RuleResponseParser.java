package com.claimrules.infrastructure.ai.parsing;

import com.claimrules.domain.extraction.model.AnalysisBatch;
import com.claimrules.domain.extraction.model.RuleCandidate;
import com.claimrules.domain.extraction.model.RuleKind;
import com.claimrules.domain.extraction.model.RuleProvenance;
import com.claimrules.domain.extraction.model.SequenceReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a raw reasoning reply into rule candidates.
 * <p>
 * JSON is located with three strategies, in order:
 * 1. parse the whole reply,
 * 2. strip a fenced code block ({@code ```json ... ```} or {@code ``` ... ```}) and parse,
 * 3. scan for the first balanced {@code {...}} or {@code [...]} span that parses and holds
 *    at least one rule object. Spans such as {@code [1]} in surrounding prose are skipped.
 * </p>
 * Accepted roots: an object with a {@code rules} array, a bare array of rules, or a single rule object.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleResponseParser {

    private final ObjectMapper objectMapper;

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern CLAIM_NUMBER = Pattern.compile("\\d{1,6}");
    private static final Pattern SEQUENCE_WILD_TYPE = Pattern.compile(
            "(?i)^SEQ[\\s_]*ID[\\s_]*NO[\\s_.:：]*(\\d{1,9})$");

    private static final List<String> RULE_ARRAY_FIELDS = List.of("rules", "protection_rules");

    /**
     * @throws ResponseParseException if no strategy yields JSON or the JSON holds no rules
     */
    public List<RuleCandidate> parse(String raw, AnalysisBatch batch) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseParseException("Empty reasoning response");
        }

        JsonNode root = readDirect(raw)
                .or(() -> readFenced(raw))
                .or(() -> readBalancedSpan(raw))
                .orElseThrow(() -> new ResponseParseException(
                        "No JSON found in reasoning response (" + raw.length() + " chars)"));

        List<JsonNode> ruleNodes = ruleNodes(root);
        List<RuleCandidate> candidates = new ArrayList<>();
        for (JsonNode node : ruleNodes) {
            toCandidate(node, batch).ifPresent(candidates::add);
        }

        if (candidates.isEmpty()) {
            throw new ResponseParseException("Reasoning response contains no usable rules");
        }
        log.debug("[Parser] Batch {}: {} rule candidates from {} nodes", batch.batchId(), candidates.size(), ruleNodes.size());
        return candidates;
    }

    // ===== Strategies =====

    private Optional<JsonNode> readDirect(String raw) {
        return tryRead(raw.strip());
    }

    private Optional<JsonNode> readFenced(String raw) {
        Matcher matcher = CODE_FENCE.matcher(raw);
        while (matcher.find()) {
            Optional<JsonNode> node = tryRead(matcher.group(1));
            if (node.isPresent()) {
                log.debug("[Parser] Parsed JSON from fenced block");
                return node;
            }
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readBalancedSpan(String raw) {
        for (int start = 0; start < raw.length(); start++) {
            char c = raw.charAt(start);
            if (c != '{' && c != '[') {
                continue;
            }
            int end = findClosing(raw, start);
            if (end < 0) {
                continue;
            }
            Optional<JsonNode> node = tryRead(raw.substring(start, end + 1)).filter(this::holdsRuleObjects);
            if (node.isPresent()) {
                log.debug("[Parser] Parsed JSON from balanced span at {}", start);
                return node;
            }
        }
        return Optional.empty();
    }

    /**
     * Index of the bracket closing the one at {@code start}, skipping string literals; -1 if unbalanced.
     */
    static int findClosing(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> depth++;
                case '}', ']' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                    if (depth < 0) {
                        return -1;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    private Optional<JsonNode> tryRead(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && (node.isObject() || node.isArray())) {
                return Optional.of(node);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("[Parser] Not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    // ===== Mapping =====

    private List<JsonNode> ruleNodes(JsonNode root) {
        return findRuleNodes(root).orElseThrow(() ->
                new ResponseParseException("JSON has no rules array and is not a rule object"));
    }

    private boolean holdsRuleObjects(JsonNode root) {
        return findRuleNodes(root)
                .map(nodes -> nodes.stream().anyMatch(JsonNode::isObject))
                .orElse(false);
    }

    private Optional<List<JsonNode>> findRuleNodes(JsonNode root) {
        List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(nodes::add);
            return Optional.of(nodes);
        }
        for (String field : RULE_ARRAY_FIELDS) {
            JsonNode array = root.get(field);
            if (array != null && array.isArray()) {
                array.forEach(nodes::add);
                return Optional.of(nodes);
            }
        }
        if (root.has("wild_type") || root.has("rule")) {
            nodes.add(root);
            return Optional.of(nodes);
        }
        return Optional.empty();
    }

    private Optional<RuleCandidate> toCandidate(JsonNode node, AnalysisBatch batch) {
        if (!node.isObject()) {
            log.debug("[Parser] Skipping non-object rule node: {}", node.getNodeType());
            return Optional.empty();
        }

        String wildType = canonicalWildType(text(node, "wild_type"));
        String label = text(node, "rule");
        String statement = text(node, "statement");
        if (wildType.isEmpty() && label.isEmpty() && statement.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new RuleCandidate(
                wildType,
                RuleKind.fromLabel(label),
                label,
                mutationText(node.get("mutation")),
                text(node, "mutation_logic"),
                text(node, "identity_logic"),
                statement,
                text(node, "comment"),
                RuleProvenance.of(batch.batchId(), attributedClaims(node, batch)),
                false
        ));
    }

    /**
     * Claims named by {@code claim_number}/{@code claims} that belong to the batch,
     * or every claim of the batch when none do.
     */
    private Set<Integer> attributedClaims(JsonNode node, AnalysisBatch batch) {
        Set<Integer> named = new LinkedHashSet<>();
        collectClaimNumbers(node.get("claim_number"), named);
        collectClaimNumbers(node.get("claims"), named);
        named.retainAll(batch.claimNumbers());
        return named.isEmpty() ? new LinkedHashSet<>(batch.claimNumbers()) : named;
    }

    private void collectClaimNumbers(JsonNode value, Set<Integer> target) {
        if (value == null || value.isNull()) {
            return;
        }
        if (value.isArray()) {
            value.forEach(element -> collectClaimNumbers(element, target));
        } else if (value.isIntegralNumber()) {
            target.add(value.asInt());
        } else if (value.isTextual()) {
            Matcher matcher = CLAIM_NUMBER.matcher(value.asText());
            while (matcher.find()) {
                target.add(Integer.parseInt(matcher.group()));
            }
        }
    }

    private String mutationText(JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            value.forEach(element -> parts.add(element.asText()));
            return String.join("/", parts);
        }
        return value.asText();
    }

    private String canonicalWildType(String wildType) {
        Matcher matcher = SEQUENCE_WILD_TYPE.matcher(wildType);
        if (matcher.matches()) {
            return SequenceReference.IDENTIFIER_PREFIX + Integer.parseInt(matcher.group(1));
        }
        return wildType;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText().strip() : value.toString();
    }
}
