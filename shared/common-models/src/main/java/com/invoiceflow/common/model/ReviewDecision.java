package com.invoiceflow.common.model;

public enum ReviewDecision {
    APPROVED,
    REJECTED
}
