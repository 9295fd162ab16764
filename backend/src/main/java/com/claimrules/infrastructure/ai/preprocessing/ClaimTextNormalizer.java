package com.claimrules.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes claim text before segmentation:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Document header removal (everything up to the last {@code ---} line)
 * - Generator banner removal
 * - Whitespace normalization
 */
@Component
public class ClaimTextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // Markdown-style separator line between document info and claims
    private static final Pattern HEADER_SEPARATOR = Pattern.compile("(?m)^\\s*-{3,}\\s*$");

    // e.g. *此文档由 XX 工具自动生成*
    private static final Pattern GENERATOR_BANNER = Pattern.compile("\\*此文档由.*?自动生成\\*");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t\\u3000]{2,}");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * Normalize raw claim text.
     *
     * @param text claims as extracted upstream
     * @return normalized text, or the input unchanged when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace("\r", "\n");

        result = stripHeader(result);
        result = GENERATOR_BANNER.matcher(result).replaceAll("");

        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }

    private String stripHeader(String text) {
        var matcher = HEADER_SEPARATOR.matcher(text);
        int lastEnd = -1;
        while (matcher.find()) {
            lastEnd = matcher.end();
        }
        return lastEnd >= 0 ? text.substring(lastEnd) : text;
    }
}
