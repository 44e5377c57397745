package com.invoiceflow.common.kafka;

import java.time.Duration;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceflow.common.kafka.attempt.DeliveryAttemptTracker;
import com.invoiceflow.common.kafka.config.PipelineProperties;
import com.invoiceflow.common.model.PipelineEvent;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps the processing of one delivered record with the pipeline ack policy.
 * <p>
 * Flow:
 * 1. Parse and validate the payload (malformed -> dead-letter, ack)
 * 2. Run the handler to completion
 * 3. SUCCESS -> ack; RETRYABLE_FAILURE -> nack with backoff until the redelivery
 *    ceiling, then dead-letter; PERMANENT_FAILURE -> dead-letter, ack
 * <p>
 * No ack or nack is issued before the handler returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineConsumer {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final DeliveryAttemptTracker attemptTracker;
    private final DeadLetterPublisher deadLetterPublisher;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Processes one record and settles it with the broker.
     *
     * @return the disposition applied, after the redelivery ceiling has been taken into account
     */
    public <T extends PipelineEvent> HandlerResult process(
            ConsumerRecord<String, String> record,
            Acknowledgment acknowledgment,
            PipelineMessageHandler<T> handler) {

        String messageId = messageId(record);
        log.debug("Consuming {} from partition {} offset {}: key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        T event;
        try {
            event = parse(record.value(), handler.payloadType());
        } catch (MalformedMessageException e) {
            log.error("Malformed message on {} partition {} offset {}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            HandlerResult result = HandlerResult.permanent("Malformed payload: " + e.getMessage(), e);
            return deadLetter(record, acknowledgment, messageId, result);
        }

        MDC.put(PipelineHeaders.MDC_CORRELATION_ID, event.getCorrelationId());
        try {
            HandlerResult result = invoke(handler, event);
            return switch (result.getOutcome()) {
                case SUCCESS -> acknowledge(record, acknowledgment, messageId);
                case RETRYABLE_FAILURE -> retry(record, acknowledgment, messageId, result);
                case PERMANENT_FAILURE -> deadLetter(record, acknowledgment, messageId, result);
            };
        } finally {
            MDC.remove(PipelineHeaders.MDC_CORRELATION_ID);
        }
    }

    <T extends PipelineEvent> T parse(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("Empty payload");
        }

        T event;
        try {
            event = objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(e.getOriginalMessage(), e);
        }
        if (event == null) {
            throw new MalformedMessageException("Payload is JSON null");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .collect(Collectors.joining("; "));
            throw new MalformedMessageException(message);
        }
        return event;
    }

    private <T extends PipelineEvent> HandlerResult invoke(PipelineMessageHandler<T> handler, T event) {
        try {
            HandlerResult result = handler.handle(event);
            if (result == null) {
                return HandlerResult.retryable("Handler returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Unclassified error handling {}: {}", event.getCorrelationId(), e.getMessage(), e);
            incrementCounter("unclassified_errors", event.getClass().getSimpleName());
            return HandlerResult.retryable("Unclassified error: " + e.getMessage(), e);
        }
    }

    private HandlerResult acknowledge(ConsumerRecord<String, String> record, Acknowledgment acknowledgment,
            String messageId) {
        clearAttempts(messageId);
        acknowledgment.acknowledge();
        incrementCounter("acked", record.topic());
        return HandlerResult.success();
    }

    private HandlerResult retry(ConsumerRecord<String, String> record, Acknowledgment acknowledgment,
            String messageId, HandlerResult result) {
        int attempts;
        try {
            attempts = attemptTracker.recordFailure(messageId, record.topic(), result.getReason());
        } catch (RuntimeException e) {
            // Counter unavailable: requeue with the longest delay rather than risk an unbounded tight loop
            Duration delay = properties.getRedeliveryBackoff().getMax();
            log.error("Could not record delivery attempt for {}, requeueing after {}", messageId, delay, e);
            acknowledgment.nack(delay);
            incrementCounter("retried", record.topic());
            return result;
        }

        if (attempts > properties.getMaxRedeliveries()) {
            log.error("Message {} exceeded {} redeliveries, treating as permanent: {}",
                    messageId, properties.getMaxRedeliveries(), result.getReason());
            HandlerResult exhausted = HandlerResult.permanent(
                    "Redelivery ceiling exceeded after " + attempts + " attempts: " + result.getReason(),
                    result.getCause());
            return deadLetter(record, acknowledgment, messageId, exhausted, attempts);
        }

        Duration delay = properties.getRedeliveryBackoff().delayForAttempt(attempts);
        log.warn("Retryable failure for {} (attempt {}/{}), redelivering in {}ms: {}",
                messageId, attempts, properties.getMaxRedeliveries(), delay.toMillis(), result.getReason());
        acknowledgment.nack(delay);
        incrementCounter("retried", record.topic());
        return result;
    }

    private HandlerResult deadLetter(ConsumerRecord<String, String> record, Acknowledgment acknowledgment,
            String messageId, HandlerResult result) {
        return deadLetter(record, acknowledgment, messageId, result, currentAttempts(messageId));
    }

    private HandlerResult deadLetter(ConsumerRecord<String, String> record, Acknowledgment acknowledgment,
            String messageId, HandlerResult result, int attempts) {
        try {
            deadLetterPublisher.publish(record, result.getReason(), attempts);
        } catch (RuntimeException e) {
            // Never drop: keep the record on the working queue until the dead-letter copy is confirmed
            Duration delay = properties.getRedeliveryBackoff().getMax();
            log.error("Failed to dead-letter {}, requeueing after {}", messageId, delay, e);
            acknowledgment.nack(delay);
            incrementCounter("dead_letter_failures", record.topic());
            return HandlerResult.retryable("Dead-letter publish failed: " + e.getMessage(), e);
        }

        clearAttempts(messageId);
        acknowledgment.acknowledge();
        incrementCounter("dead_lettered", record.topic());
        return result;
    }

    private int currentAttempts(String messageId) {
        try {
            return attemptTracker.attempts(messageId);
        } catch (RuntimeException e) {
            log.warn("Could not read delivery attempts for {}: {}", messageId, e.getMessage());
            return 0;
        }
    }

    private void clearAttempts(String messageId) {
        try {
            attemptTracker.clear(messageId);
        } catch (RuntimeException e) {
            log.warn("Could not clear delivery attempts for {}: {}", messageId, e.getMessage());
        }
    }

    String messageId(ConsumerRecord<String, String> record) {
        return properties.getServiceName() + ":" + record.topic() + "/" + record.partition() + "/" + record.offset();
    }

    private void incrementCounter(String name, String topic) {
        Counter.builder("invoiceflow.consumer." + name)
                .tag("service", properties.getServiceName())
                .tag("topic", topic)
                .register(meterRegistry)
                .increment();
    }
}
