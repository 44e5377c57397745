package com.invoiceflow.common.model;

/**
 * Common contract of every payload exchanged between pipeline stages.
 * The correlation id is the invoice id and threads one invoice through all stages.
 */
public interface PipelineEvent {

    String getCorrelationId();
}
