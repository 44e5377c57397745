package com.invoiceflow.common.model;

/**
 * Sub-state of the extraction stage while the invoice itself is PROCESSING.
 */
public enum ExtractionStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
