package com.invoiceflow.common.kafka;

import java.time.Instant;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes a copy of an unprocessable record to {@code <topic>.dlq} for operator inspection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterPublisher {

    private final PipelineEventPublisher publisher;

    public void publish(ConsumerRecord<String, String> original, String reason, int attempts) {
        String topic = KafkaTopics.deadLetterTopic(original.topic());
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, original.key(), original.value());

        original.headers().forEach(header -> record.headers().add(header));
        PipelineEventPublisher.addHeader(record, PipelineHeaders.DLQ_REASON, reason);
        PipelineEventPublisher.addHeader(record, PipelineHeaders.DLQ_ORIGINAL_TOPIC, original.topic());
        PipelineEventPublisher.addHeader(record, PipelineHeaders.DLQ_ORIGINAL_PARTITION,
                String.valueOf(original.partition()));
        PipelineEventPublisher.addHeader(record, PipelineHeaders.DLQ_ORIGINAL_OFFSET,
                String.valueOf(original.offset()));
        PipelineEventPublisher.addHeader(record, PipelineHeaders.DLQ_ATTEMPTS, String.valueOf(attempts));
        PipelineEventPublisher.addHeader(record, PipelineHeaders.DLQ_FAILED_AT, Instant.now().toString());

        publisher.send(record);
        log.warn("Dead-lettered record {}-{}@{} to {}: {}",
                original.topic(), original.partition(), original.offset(), topic, reason);
    }
}
