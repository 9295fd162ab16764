package com.claimrules.infrastructure.ai.segmentation;

import com.claimrules.domain.extraction.model.ClaimKind;
import com.claimrules.domain.extraction.model.ClaimSegment;
import com.claimrules.domain.extraction.model.ProcessingLogEntry;
import com.claimrules.domain.extraction.model.ProcessingLogEntry.Stage;
import com.claimrules.domain.extraction.model.SequenceReference;
import com.claimrules.infrastructure.ai.preprocessing.ClaimTextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document's claim text into claim segments. No reasoning call.
 *
 * Steps:
 *   1. Normalize text (header, banner, whitespace)
 *   2. Find claim boundaries: a number plus delimiter ({@code 1.} {@code 1．} {@code 1、})
 *      at the start of the text, at a line start, or directly after {@code 。}.
 *      Enumerated steps inside a claim ({@code 1)}, {@code ; 2.}) are not boundaries.
 *      A boundary is accepted only if its number is greater than the previous accepted one;
 *      anything else stays in the claim body.
 *   3. Tokenize each claim body in one pass and derive dependencies, sequence references,
 *      mutation codes and complexity.
 *
 * Slices that cannot become a claim (text before the first boundary, empty bodies) are dropped
 * and reported in {@link SegmentationResult#issues()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClaimSegmenter {

    // ── Internal records ──

    private record Boundary(int claimNumber, int start, int bodyStart) {}

    private record Slice(Integer claimNumber, String body) {}

    // ── Collaborators ──

    private final ClaimTextNormalizer textNormalizer;
    private final ClaimTokenizer tokenizer;
    private final ComplexityScorer complexityScorer;

    // ── Configurable thresholds ──

    @Value("${segmenter.context-window:40}")
    private int contextWindow = 40;

    private static final int PREVIEW_LENGTH = 30;

    // ── Patterns ──

    private static final Pattern CLAIM_BOUNDARY = Pattern.compile(
            "(?:^|(?<=[\\n。]))[ \\t]*(\\d{1,3})[ \\t]*[.．、](?!\\d)");

    public SegmentationResult segment(String claimsText) {
        if (claimsText == null || claimsText.isBlank()) {
            log.warn("[Segmenter] Empty claims text");
            return SegmentationResult.empty();
        }

        String text = textNormalizer.normalize(claimsText);
        List<ClaimSegment> segments = new ArrayList<>();
        List<ProcessingLogEntry> issues = new ArrayList<>();

        for (Slice slice : slice(text)) {
            try {
                segments.add(buildSegment(slice));
            } catch (ClaimSegmentationException e) {
                log.warn("[Segmenter] Dropped slice: {}", e.getMessage());
                issues.add(ProcessingLogEntry.warning(Stage.SEGMENTATION, e.getMessage()));
            }
        }

        long dependent = segments.stream().filter(ClaimSegment::isDependent).count();
        log.info("[Segmenter] {} claims segmented ({} independent, {} dependent), {} slices dropped",
                segments.size(), segments.size() - dependent, dependent, issues.size());

        return new SegmentationResult(segments, issues);
    }

    // ===== Internal methods =====

    private List<Slice> slice(String text) {
        List<Boundary> boundaries = new ArrayList<>();
        Matcher matcher = CLAIM_BOUNDARY.matcher(text);
        int lastNumber = 0;
        while (matcher.find()) {
            int number = Integer.parseInt(matcher.group(1));
            if (number > lastNumber) {
                boundaries.add(new Boundary(number, matcher.start(), matcher.end()));
                lastNumber = number;
            }
        }

        List<Slice> slices = new ArrayList<>();
        int firstStart = boundaries.isEmpty() ? text.length() : boundaries.get(0).start();
        String preamble = text.substring(0, firstStart);
        if (!preamble.isBlank()) {
            slices.add(new Slice(null, preamble));
        }

        for (int i = 0; i < boundaries.size(); i++) {
            Boundary boundary = boundaries.get(i);
            int end = i + 1 < boundaries.size() ? boundaries.get(i + 1).start() : text.length();
            slices.add(new Slice(boundary.claimNumber(), text.substring(boundary.bodyStart(), end)));
        }
        return slices;
    }

    private ClaimSegment buildSegment(Slice slice) {
        if (slice.claimNumber() == null) {
            throw new ClaimSegmentationException("No claim number for text \"" + preview(slice.body()) + "\"");
        }
        int claimNumber = slice.claimNumber();
        String body = slice.body().strip();
        if (body.isEmpty()) {
            throw new ClaimSegmentationException("Claim " + claimNumber + " has an empty body");
        }

        Set<Integer> dependencyRefs = new TreeSet<>();
        Map<Integer, SequenceReference> sequenceRefs = new LinkedHashMap<>();
        Set<String> mutations = new TreeSet<>();
        int connectives = 0;
        int percentages = 0;

        for (ClaimToken token : tokenizer.tokenize(body)) {
            switch (token.type()) {
                case CLAIM_REFERENCE -> ClaimTokenizer.referencedNumbers(token.text()).stream()
                        .filter(ref -> ref > 0 && ref != claimNumber)
                        .forEach(dependencyRefs::add);
                case SEQUENCE_REFERENCE -> {
                    String context = contextAround(body, token);
                    for (int id : ClaimTokenizer.referencedNumbers(token.text())) {
                        if (id > 0) {
                            sequenceRefs.putIfAbsent(id, SequenceReference.of(id, context));
                        }
                    }
                }
                case MUTATION -> mutations.addAll(ClaimTokenizer.mutationCodes(token.text()));
                case PERCENTAGE -> percentages++;
                case CONNECTIVE -> connectives++;
            }
        }

        boolean dependent = dependencyRefs.stream().anyMatch(ref -> ref < claimNumber);
        double complexity = complexityScorer.score(
                body.length(), sequenceRefs.size(), mutations.size(), connectives, percentages);

        log.debug("[Segmenter] Claim {}: refs={}, seqRefs={}, mutations={}, complexity={}",
                claimNumber, dependencyRefs, sequenceRefs.keySet(), mutations.size(),
                String.format("%.2f", complexity));

        return new ClaimSegment(
                claimNumber,
                body,
                dependent ? ClaimKind.DEPENDENT : ClaimKind.INDEPENDENT,
                dependencyRefs,
                List.copyOf(sequenceRefs.values()),
                mutations,
                complexity
        );
    }

    private String contextAround(String body, ClaimToken token) {
        int window = Math.max(contextWindow, 0);
        int start = Math.max(0, token.start() - window);
        int end = Math.min(body.length(), token.end() + window);
        return body.substring(start, end);
    }

    private static String preview(String text) {
        String stripped = text.strip();
        return stripped.length() <= PREVIEW_LENGTH ? stripped : stripped.substring(0, PREVIEW_LENGTH) + "...";
    }
}
