package com.invoiceflow.common.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceflow.common.kafka.config.PipelineProperties;
import com.invoiceflow.common.model.InvoiceIngestedEvent;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineEventPublisher Tests")
class PipelineEventPublisherTest {

    private static final String CORRELATION_ID = "6f1c2d4e-8a9b-4c3d-9e0f-112233445566";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private PipelineProperties properties;
    private PipelineEventPublisher publisher;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setServiceName("test-service");
        properties.setPublishTimeout(Duration.ofMillis(50));
        publisher = new PipelineEventPublisher(kafkaTemplate, new ObjectMapper().findAndRegisterModules(), properties);
    }

    private static InvoiceIngestedEvent ingested() {
        return InvoiceIngestedEvent.builder()
                .correlationId(CORRELATION_ID)
                .documentKey("uploads/" + CORRELATION_ID + ".pdf")
                .filename("acme-march.pdf")
                .build();
    }

    private void givenSendReturns(CompletableFuture<SendResult<String, String>> future) {
        when(kafkaTemplate.send(ArgumentMatchers.<ProducerRecord<String, String>>any())).thenReturn(future);
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Confirmed publishes")
    class ConfirmedTests {

        @Test
        @DisplayName("Should key the record by correlation id and stamp the standard headers")
        void shouldStampHeaders() {
            // Given
            givenSendReturns(CompletableFuture.completedFuture(null));
            Instant before = Instant.now();

            // When
            publisher.publish(KafkaTopics.INVOICES_EXTRACTED, CORRELATION_ID, ingested());

            // Then
            verify(kafkaTemplate).send(recordCaptor.capture());
            ProducerRecord<String, String> record = recordCaptor.getValue();
            assertThat(record.topic()).isEqualTo(KafkaTopics.INVOICES_EXTRACTED);
            assertThat(record.key()).isEqualTo(CORRELATION_ID);
            assertThat(record.value()).contains("\"documentKey\":\"uploads/" + CORRELATION_ID + ".pdf\"");

            assertThat(header(record, PipelineHeaders.CORRELATION_ID)).isEqualTo(CORRELATION_ID);
            assertThat(header(record, PipelineHeaders.CONTENT_TYPE)).isEqualTo("application/json");
            assertThat(header(record, PipelineHeaders.SOURCE_SERVICE)).isEqualTo("test-service");
            assertThat(Instant.parse(header(record, PipelineHeaders.TIMESTAMP))).isAfterOrEqualTo(before);
        }

        @Test
        @DisplayName("Should send a prebuilt record as is")
        void shouldSendPrebuiltRecord() {
            // Given
            givenSendReturns(CompletableFuture.completedFuture(null));
            ProducerRecord<String, String> record = new ProducerRecord<>("invoices.posted.dlq", "k", "v");

            // When
            publisher.send(record);

            // Then
            verify(kafkaTemplate).send(record);
        }
    }

    @Nested
    @DisplayName("Unconfirmed publishes")
    class UnconfirmedTests {

        @Test
        @DisplayName("Should raise with the broker's cause when the send is rejected")
        void shouldRaiseOnRejectedSend() {
            // Given
            RecordTooLargeException rejected = new RecordTooLargeException("message too large");
            givenSendReturns(CompletableFuture.failedFuture(rejected));

            // When / Then
            assertThatThrownBy(() -> publisher.publish(KafkaTopics.INVOICES_EXTRACTED, CORRELATION_ID, ingested()))
                    .isInstanceOf(EventPublishException.class)
                    .hasMessageContaining("Broker rejected publish to invoices.extracted")
                    .hasCause(rejected);
        }

        @Test
        @DisplayName("Should raise when the broker does not confirm within the publish timeout")
        void shouldRaiseOnTimeout() {
            // Given
            givenSendReturns(new CompletableFuture<>());

            // When / Then
            assertThatThrownBy(() -> publisher.publish(KafkaTopics.INVOICES_EXTRACTED, CORRELATION_ID, ingested()))
                    .isInstanceOf(EventPublishException.class)
                    .hasMessageContaining("not confirmed within 50ms")
                    .hasCauseInstanceOf(TimeoutException.class);
        }

        @Test
        @DisplayName("Should raise and keep the interrupt flag when interrupted while waiting")
        void shouldRestoreInterruptFlag() {
            // Given
            givenSendReturns(new CompletableFuture<>());
            Thread.currentThread().interrupt();

            // When / Then
            try {
                assertThatThrownBy(() -> publisher.publish(KafkaTopics.INVOICES_EXTRACTED, CORRELATION_ID, ingested()))
                        .isInstanceOf(EventPublishException.class)
                        .hasMessageContaining("Interrupted");
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("Should raise without sending when the payload cannot be serialized")
        void shouldRaiseOnUnserializablePayload() {
            assertThatThrownBy(() -> publisher.publish(KafkaTopics.INVOICES_EXTRACTED, CORRELATION_ID, new Object()))
                    .isInstanceOf(EventPublishException.class)
                    .hasMessageContaining("Failed to serialize event for " + CORRELATION_ID);
            verifyNoInteractions(kafkaTemplate);
        }
    }
}
