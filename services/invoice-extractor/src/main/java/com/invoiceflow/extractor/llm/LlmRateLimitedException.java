package com.invoiceflow.extractor.llm;

/**
 * The language-model provider answered 429. Retryable by redelivery.
 */
public class LlmRateLimitedException extends RuntimeException {

    public LlmRateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
