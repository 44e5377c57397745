package com.invoiceflow.common.model;

public enum PostingStatus {
    POSTED,
    POSTING_FAILED;

    public InvoiceStatus toInvoiceStatus() {
        return InvoiceStatus.valueOf(name());
    }
}
