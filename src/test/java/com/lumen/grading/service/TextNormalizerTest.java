package com.lumen.grading.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    void typedTextIsKeptVerbatimApartFromTrimming() {
        assertThat(normalizer.normalizeTyped("  The cat sat on the mat.  ")).isEqualTo("The cat sat on the mat.");
    }

    @Test
    void typedTextLineEndingsAreUnified() {
        assertThat(normalizer.normalizeTyped("one\r\ntwo\rthree")).isEqualTo("one\ntwo\nthree");
    }

    @Test
    void typedTextKeepsTabsButDropsOtherControlCharacters() {
        assertThat(normalizer.normalizeTyped("a\tb\u0000c\u0007d")).isEqualTo("a\tbcd");
    }

    @Test
    void ocrOutputIsFlattened() {
        assertThat(normalizer.normalizeOcr("  Dear  Sir,\n\n I am\twriting\u000c today ")).isEqualTo("Dear Sir, I am writing today");
    }

    @Test
    void meaningfulLengthCountsLettersAndDigitsOnly() {
        assertThat(normalizer.meaningfulLength("a-b c! 12")).isEqualTo(5);
        assertThat(normalizer.meaningfulLength("~~ .. ~~")).isZero();
        assertThat(normalizer.meaningfulLength(null)).isZero();
    }

    @Test
    void truncateKeepsSurrogatePairsWhole() {
        String text = "a".repeat(49) + "\uD83D\uDE00";

        assertThat(TextNormalizer.truncate(text, 50)).isEqualTo("a".repeat(49));
        assertThat(TextNormalizer.truncate(text, 51)).isEqualTo(text);
        assertThat(TextNormalizer.truncate("short", 50)).isEqualTo("short");
        assertThat(TextNormalizer.truncate(null, 50)).isNull();
    }
}
