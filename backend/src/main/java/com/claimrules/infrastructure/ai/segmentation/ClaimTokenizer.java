package com.claimrules.infrastructure.ai.segmentation;

import com.claimrules.domain.extraction.model.MutationCodes;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single left-to-right scan of claim text into typed tokens.
 * <p>
 * All token kinds live in one alternation, so each character belongs to at most one token.
 * At a given position the alternatives are tried in this order:
 * claim reference, sequence reference, mutation, percentage, connective.
 * The {@code 或} in {@code 权利要求1或2} is therefore part of the claim reference
 * and is not also counted as a connective.
 * </p>
 */
@Component
public class ClaimTokenizer {

    private static final int MAX_RANGE_SPAN = 200;

    private static final String RANGE_DELIMITER = "(?:[-‑–~～至到]|to)";
    private static final String NUMBER_OR_RANGE = "\\d+(?:\\s*" + RANGE_DELIMITER + "\\s*\\d+)?";
    private static final String LIST_DELIMITER = "(?:[,，、]|以及|或者|或|和|及|or|and)";
    private static final String NUMBER_LIST =
            NUMBER_OR_RANGE + "(?:\\s*" + LIST_DELIMITER + "\\s*" + NUMBER_OR_RANGE + ")*";

    private static final String CLAIM_REFERENCE =
            "(?<claimref>(?:权利要求|(?<![A-Za-z])[Cc]laims?\\s*)\\s*" + NUMBER_LIST + ")";
    private static final String SEQUENCE_REFERENCE =
            "(?<seqref>(?i:SEQ\\s*ID\\s*NO)\\s*[.:：]?\\s*" + NUMBER_LIST + ")";
    private static final String MUTATION =
            "(?<mutation>(?<![A-Za-z0-9])[A-Z]\\d{1,4}[A-Z*](?:/[A-Z]\\d{1,4}[A-Z*])*(?![A-Za-z0-9]))";
    private static final String PERCENTAGE = "(?<percent>\\d+(?:\\.\\d+)?\\s*[%％])";
    private static final String CONNECTIVE =
            "(?<connective>和/或|(?i:and/or)|以及|任何组合|(?i:any\\s+combination)"
                    + "|(?<![A-Za-z])(?i:and|or)(?![A-Za-z])|和|或)";

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            CLAIM_REFERENCE + "|" + SEQUENCE_REFERENCE + "|" + MUTATION + "|" + PERCENTAGE + "|" + CONNECTIVE);

    private static final Pattern NUMBER_OR_RANGE_PATTERN = Pattern.compile(
            "(\\d+)(?:\\s*" + RANGE_DELIMITER + "\\s*(\\d+))?");

    public List<ClaimToken> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<ClaimToken> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        while (matcher.find()) {
            ClaimToken.Type type = typeOf(matcher);
            tokens.add(new ClaimToken(type, matcher.group(), matcher.start(), matcher.end()));
        }
        return tokens;
    }

    /**
     * Expands the numbers of a claim or sequence reference, e.g. {@code 权利要求1-3或5} → [1, 2, 3, 5].
     * Ranges wider than {@value #MAX_RANGE_SPAN} or reversed contribute only their endpoints.
     */
    public static List<Integer> referencedNumbers(String tokenText) {
        Set<Integer> numbers = new LinkedHashSet<>();
        Matcher matcher = NUMBER_OR_RANGE_PATTERN.matcher(tokenText);
        while (matcher.find()) {
            int from = parse(matcher.group(1));
            if (matcher.group(2) == null) {
                numbers.add(from);
                continue;
            }
            int to = parse(matcher.group(2));
            if (to >= from && to - from <= MAX_RANGE_SPAN) {
                for (int n = from; n <= to; n++) {
                    numbers.add(n);
                }
            } else {
                numbers.add(from);
                numbers.add(to);
            }
        }
        return List.copyOf(numbers);
    }

    /**
     * Splits a mutation token such as {@code W46E/Q62W/Y178*} into normalized codes.
     */
    public static List<String> mutationCodes(String tokenText) {
        List<String> codes = new ArrayList<>();
        for (String part : tokenText.split("/")) {
            codes.add(MutationCodes.normalize(part));
        }
        return codes;
    }

    // ===== Internal methods =====

    private static ClaimToken.Type typeOf(Matcher matcher) {
        if (matcher.group("claimref") != null) {
            return ClaimToken.Type.CLAIM_REFERENCE;
        }
        if (matcher.group("seqref") != null) {
            return ClaimToken.Type.SEQUENCE_REFERENCE;
        }
        if (matcher.group("mutation") != null) {
            return ClaimToken.Type.MUTATION;
        }
        if (matcher.group("percent") != null) {
            return ClaimToken.Type.PERCENTAGE;
        }
        return ClaimToken.Type.CONNECTIVE;
    }

    private static int parse(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // longer than int; treat as out-of-range reference
            return -1;
        }
    }
}
