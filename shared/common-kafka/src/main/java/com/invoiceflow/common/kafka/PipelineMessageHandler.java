package com.invoiceflow.common.kafka;

import com.invoiceflow.common.model.PipelineEvent;

/**
 * Stage-specific processing of one parsed pipeline event.
 * <p>
 * Implementations classify their own failures and must not throw: any exception that
 * escapes is treated as a retryable failure by the framework.
 */
public interface PipelineMessageHandler<T extends PipelineEvent> {

    Class<T> payloadType();

    HandlerResult handle(T event);
}
