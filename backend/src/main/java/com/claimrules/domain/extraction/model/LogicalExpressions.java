package com.claimrules.domain.extraction.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks on the boolean mutation expressions attached to rules, e.g. {@code (W46E&Q62W)|Y178A}.
 */
public final class LogicalExpressions {

    private static final Pattern EXPRESSION_TOKEN = Pattern.compile(
            "\\s*(?:[A-Z]\\d{1,4}[A-Z*]|&&?|\\|\\|?|!|\\(|\\)|AND\\b|OR\\b|NOT\\b)");
    private static final Pattern CODE = Pattern.compile("[A-Z]\\d{1,4}[A-Z*]");
    private static final Pattern OPERATOR_WORD = Pattern.compile("\\b(?:AND|OR|NOT)\\b");
    private static final Pattern CONNECTIVE_WORD = Pattern.compile("\\b(?:AND|OR)\\b");

    private LogicalExpressions() {
    }

    /**
     * True if the expression joins terms: contains {@code &}, {@code |}, {@code (} or AND/OR.
     */
    public static boolean hasOperator(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        return expression.indexOf('&') >= 0
                || expression.indexOf('|') >= 0
                || expression.indexOf('(') >= 0
                || CONNECTIVE_WORD.matcher(expression).find();
    }

    /**
     * Counts {@code & | ! (} characters plus AND/OR/NOT words.
     */
    public static int countOperators(String expression) {
        if (expression == null || expression.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '&' || c == '|' || c == '!' || c == '(') {
                count++;
            }
        }
        Matcher words = OPERATOR_WORD.matcher(expression);
        while (words.find()) {
            count++;
        }
        return count;
    }

    /**
     * Balanced parentheses, at least one mutation code, and nothing but codes, operators and parentheses.
     */
    public static boolean isWellFormed(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        String trimmed = expression.strip();
        Matcher matcher = EXPRESSION_TOKEN.matcher(trimmed);
        int position = 0;
        int depth = 0;
        boolean sawCode = false;

        while (position < trimmed.length()) {
            matcher.region(position, trimmed.length());
            if (!matcher.lookingAt()) {
                return false;
            }
            String token = matcher.group().strip();
            if (token.equals("(")) {
                depth++;
            } else if (token.equals(")")) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            } else if (CODE.matcher(token).matches()) {
                sawCode = true;
            }
            position = matcher.end();
        }
        return depth == 0 && sawCode;
    }
}
