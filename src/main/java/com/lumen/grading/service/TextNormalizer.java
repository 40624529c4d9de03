package com.lumen.grading.service;

import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Normalization applied to extracted text before evaluation.
 */
@Component
public class TextNormalizer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern CONTROL_EXCEPT_NEWLINE_TAB = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]");
    private static final Pattern CONTROL = Pattern.compile("\\p{Cc}");
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    /**
     * Typed text keeps its layout: line endings become \n, control
     * characters other than newline and tab are removed, outer whitespace is
     * trimmed.
     */
    public String normalizeTyped(String text) {
        if (text == null) {
            return "";
        }
        String unified = LINE_BREAKS.matcher(text).replaceAll("\n");
        return CONTROL_EXCEPT_NEWLINE_TAB.matcher(unified).replaceAll("").strip();
    }

    /**
     * OCR output is flattened: control characters become spaces and every
     * whitespace run collapses to one space.
     */
    public String normalizeOcr(String text) {
        if (text == null) {
            return "";
        }
        String noControl = CONTROL.matcher(text).replaceAll(" ");
        return WHITESPACE_RUNS.matcher(noControl).replaceAll(" ").strip();
    }

    /**
     * Number of letters and digits in the text.
     */
    public int meaningfulLength(String text) {
        if (text == null) {
            return 0;
        }
        return (int) text.codePoints().filter(Character::isLetterOrDigit).count();
    }

    /**
     * Cut text to at most {@code maxLength} chars without splitting a surrogate pair.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return text.substring(0, end);
    }
}
