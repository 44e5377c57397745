package com.invoiceflow.common.kafka;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceflow.common.kafka.config.PipelineProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes pipeline events and waits for broker confirmation.
 * <p>
 * Callers persist first and publish second; a publish that is not confirmed raises
 * {@link EventPublishException} so the message can be retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public void publish(String topic, String correlationId, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EventPublishException("Failed to serialize event for " + correlationId, e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, correlationId, json);
        addHeader(record, PipelineHeaders.CORRELATION_ID, correlationId);
        addHeader(record, PipelineHeaders.TIMESTAMP, Instant.now().toString());
        addHeader(record, PipelineHeaders.CONTENT_TYPE, PipelineHeaders.APPLICATION_JSON);
        addHeader(record, PipelineHeaders.SOURCE_SERVICE, properties.getServiceName());

        send(record);
        log.info("Published event for {} to {}", correlationId, topic);
    }

    /**
     * Sends a fully built record and blocks until the broker acknowledges it.
     */
    public void send(ProducerRecord<String, String> record) {
        long timeoutMs = properties.getPublishTimeout().toMillis();
        try {
            kafkaTemplate.send(record).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing to " + record.topic(), e);
        } catch (ExecutionException e) {
            throw new EventPublishException("Broker rejected publish to " + record.topic(), e.getCause());
        } catch (TimeoutException e) {
            throw new EventPublishException(
                    "Publish to " + record.topic() + " not confirmed within " + timeoutMs + "ms", e);
        }
    }

    static void addHeader(ProducerRecord<String, String> record, String name, String value) {
        if (value != null) {
            record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
        }
    }
}
