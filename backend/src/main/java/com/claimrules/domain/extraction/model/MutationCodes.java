package com.claimrules.domain.extraction.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Mutation code helpers. A code is original residue + position + substituted residue,
 * e.g. {@code Y178A}. A substituted residue of {@code X} (or {@code *}) is a wildcard.
 */
public final class MutationCodes {

    public static final String SEPARATOR = "/";

    private static final Pattern CODE = Pattern.compile("[A-Z]\\d{1,4}[A-Z]");
    private static final Pattern DESCRIPTOR_SPLIT = Pattern.compile("[/,，、;；\\s]+");

    private MutationCodes() {
    }

    public static boolean isValid(String code) {
        return code != null && CODE.matcher(code).matches();
    }

    /**
     * Upper-cases the token and turns a trailing {@code *} into the {@code X} wildcard.
     */
    public static String normalize(String token) {
        if (token == null) {
            return "";
        }
        String upper = token.strip().toUpperCase(Locale.ROOT);
        if (upper.endsWith("*")) {
            upper = upper.substring(0, upper.length() - 1) + "X";
        }
        return upper;
    }

    /**
     * Splits a descriptor into valid codes, first-seen order, duplicates and invalid tokens dropped.
     */
    public static List<String> parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            return List.of();
        }
        Set<String> codes = new LinkedHashSet<>();
        for (String token : DESCRIPTOR_SPLIT.split(descriptor.strip())) {
            String code = normalize(token);
            if (isValid(code)) {
                codes.add(code);
            }
        }
        return List.copyOf(codes);
    }

    public static String join(Collection<String> codes) {
        return String.join(SEPARATOR, codes);
    }

    /**
     * Rewrites a descriptor so that it only contains valid codes.
     */
    public static String sanitize(String descriptor) {
        return join(parse(descriptor));
    }
}
