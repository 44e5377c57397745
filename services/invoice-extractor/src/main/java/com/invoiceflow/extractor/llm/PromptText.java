package com.invoiceflow.extractor.llm;

import lombok.Value;

/**
 * OCR text bounded to the prompt budget.
 */
@Value
public class PromptText {

    static final String TRUNCATION_MARKER = "...[truncated]";

    String text;
    boolean truncated;

    public static PromptText bounded(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return new PromptText(text, false);
        }
        int end = maxChars;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return new PromptText(text.substring(0, end) + TRUNCATION_MARKER, true);
    }
}
