package com.invoiceflow.common.model;

/**
 * Bounds free-form error text (exception messages, remote error bodies) before it is stored.
 */
public final class ErrorText {

    /** Length of the error columns on the invoices table. */
    public static final int MAX_LENGTH = 2000;

    private ErrorText() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String bounded(String text) {
        return bounded(text, MAX_LENGTH);
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} chars without splitting a surrogate pair.
     */
    public static String bounded(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
