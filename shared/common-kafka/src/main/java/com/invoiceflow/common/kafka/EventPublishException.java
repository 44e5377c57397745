package com.invoiceflow.common.kafka;

/**
 * The broker did not confirm a publish within the configured timeout.
 */
public class EventPublishException extends RuntimeException {

    public EventPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
