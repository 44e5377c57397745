package com.invoiceflow.poster.erp;

import com.invoiceflow.common.model.ErrorText;

import lombok.Value;

@Value
public class ErpPostingOutcome {

    boolean posted;

    String externalReference;

    String error;

    /** HTTP calls made, including the first. */
    int attempts;

    public static ErpPostingOutcome posted(String externalReference, int attempts) {
        return new ErpPostingOutcome(true, externalReference, null, attempts);
    }

    /**
     * The error is bounded to the {@code posting_error} column length.
     */
    public static ErpPostingOutcome failed(String error, int attempts) {
        return new ErpPostingOutcome(false, null, ErrorText.bounded(error), attempts);
    }
}
