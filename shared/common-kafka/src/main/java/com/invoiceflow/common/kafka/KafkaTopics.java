package com.invoiceflow.common.kafka;

import java.util.List;

/**
 * Centralized Kafka topic names for the invoice pipeline.
 */
public final class KafkaTopics {

    // Pipeline topics, in stage order
    public static final String INVOICES_INGESTED = "invoices.ingested";
    public static final String INVOICES_EXTRACTED = "invoices.extracted";
    public static final String INVOICES_MATCHED = "invoices.matched";
    public static final String INVOICES_APPROVED = "invoices.approved";
    public static final String INVOICES_POSTED = "invoices.posted";

    public static final List<String> PIPELINE_TOPICS = List.of(
            INVOICES_INGESTED,
            INVOICES_EXTRACTED,
            INVOICES_MATCHED,
            INVOICES_APPROVED,
            INVOICES_POSTED);

    // Dead letter queue
    public static final String DLQ_SUFFIX = ".dlq";

    private KafkaTopics() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String deadLetterTopic(String topic) {
        return topic + DLQ_SUFFIX;
    }
}
