package com.invoiceflow.common.kafka.attempt;

/**
 * Counts failed deliveries per message, independently of the broker.
 */
public interface DeliveryAttemptTracker {

    /**
     * Records one failed attempt and returns the total number of failed attempts so far.
     */
    int recordFailure(String messageId, String topic, String error);

    int attempts(String messageId);

    void clear(String messageId);
}
