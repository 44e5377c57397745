package com.invoiceflow.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an invoice as it moves through the pipeline.
 *
 * <pre>
 * PENDING -> PROCESSING -> {NEEDS_REVIEW | AUTO_APPROVED} -> REVIEWED -> {POSTED | POSTING_FAILED}
 * PROCESSING -> FAILED
 * </pre>
 *
 * Status only moves forward. Every stage writes its transition as a conditional
 * update guarded on the expected current status.
 */
public enum InvoiceStatus {
    PENDING,
    PROCESSING,
    NEEDS_REVIEW,
    AUTO_APPROVED,
    REVIEWED,
    POSTED,
    POSTING_FAILED,
    FAILED;

    public Set<InvoiceStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(NEEDS_REVIEW, AUTO_APPROVED, FAILED);
            case NEEDS_REVIEW, AUTO_APPROVED -> EnumSet.of(REVIEWED);
            case REVIEWED -> EnumSet.of(POSTED, POSTING_FAILED);
            case POSTED, POSTING_FAILED, FAILED -> EnumSet.noneOf(InvoiceStatus.class);
        };
    }

    public boolean canTransitionTo(InvoiceStatus next) {
        return next != null && allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }

    /**
     * Amount, vendor and purchase-order fields are frozen from review onwards.
     */
    public boolean isFinancialDataLocked() {
        return this == REVIEWED || this == POSTED || this == POSTING_FAILED;
    }
}
