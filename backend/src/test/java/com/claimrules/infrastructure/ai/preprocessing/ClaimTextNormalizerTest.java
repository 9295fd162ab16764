package com.claimrules.infrastructure.ai.preprocessing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClaimTextNormalizerTest {

    private final ClaimTextNormalizer normalizer = new ClaimTextNormalizer();

    @Test
    @DisplayName("null → null, empty → empty")
    void null_and_empty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("Document header up to the last --- line is removed")
    void header_removed() {
        String text = "# 专利 CN112345678A\n申请人: 某公司\n---\n摘要\n---\n1. 一种多肽。";
        assertThat(normalizer.normalize(text)).isEqualTo("1. 一种多肽。");
    }

    @Test
    @DisplayName("Generator banner is removed")
    void banner_removed() {
        String text = "*此文档由专利解析工具自动生成*\n1. 一种多肽。";
        assertThat(normalizer.normalize(text)).isEqualTo("1. 一种多肽。");
    }

    @Test
    @DisplayName("Zero-width and control characters are removed")
    void invisible_chars_removed() {
        String text = "1. 一种\u200B多肽\u0007。";
        assertThat(normalizer.normalize(text)).isEqualTo("1. 一种多肽。");
    }

    @Test
    @DisplayName("CRLF → LF, runs of blank lines collapsed")
    void newlines_normalized() {
        String text = "1. 一种多肽。\r\n\r\n\r\n\r\n2. 根据权利要求1所述的多肽。";
        assertThat(normalizer.normalize(text)).isEqualTo("1. 一种多肽。\n\n2. 根据权利要求1所述的多肽。");
    }

    @Test
    @DisplayName("Runs of spaces collapse to one")
    void spaces_collapsed() {
        assertThat(normalizer.normalize("1.   A   polypeptide")).isEqualTo("1. A polypeptide");
    }
}
