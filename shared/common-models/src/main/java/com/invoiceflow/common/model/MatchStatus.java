package com.invoiceflow.common.model;

/**
 * Outcome of purchase-order matching. Names match the corresponding {@link InvoiceStatus} values.
 */
public enum MatchStatus {
    AUTO_APPROVED,
    NEEDS_REVIEW;

    public InvoiceStatus toInvoiceStatus() {
        return InvoiceStatus.valueOf(name());
    }
}
