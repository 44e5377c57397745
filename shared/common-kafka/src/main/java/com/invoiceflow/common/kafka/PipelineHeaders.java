package com.invoiceflow.common.kafka;

/**
 * Header names carried by pipeline and dead-letter records.
 */
public final class PipelineHeaders {

    public static final String CORRELATION_ID = "correlation_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String CONTENT_TYPE = "content_type";
    public static final String SOURCE_SERVICE = "source_service";

    public static final String DLQ_REASON = "dlq_reason";
    public static final String DLQ_ORIGINAL_TOPIC = "dlq_original_topic";
    public static final String DLQ_ORIGINAL_PARTITION = "dlq_original_partition";
    public static final String DLQ_ORIGINAL_OFFSET = "dlq_original_offset";
    public static final String DLQ_ATTEMPTS = "dlq_attempts";
    public static final String DLQ_FAILED_AT = "dlq_failed_at";

    public static final String APPLICATION_JSON = "application/json";

    /** MDC key populated while a handler runs. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    private PipelineHeaders() {
        throw new UnsupportedOperationException("Utility class");
    }
}
