package com.invoiceflow.common.kafka;

/**
 * Payload could not be turned into a valid event. Never retried.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
