package com.invoiceflow.common.kafka.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.kafka.listener.AbstractMessageListenerContainer;

@ExtendWith(MockitoExtension.class)
@DisplayName("BrokerTopologyInitializer Tests")
class BrokerTopologyInitializerTest {

    @Mock
    private KafkaAdmin kafkaAdmin;

    private PipelineProperties properties;
    private List<Long> pauses;
    private BrokerTopologyInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setReconnectBackoff(
                new PipelineProperties.Backoff(Duration.ofMillis(100), 2.0, Duration.ofMillis(300)));
        pauses = new ArrayList<>();
        initializer = new BrokerTopologyInitializer(kafkaAdmin, properties) {
            @Override
            void pause(long delayMs) {
                pauses.add(delayMs);
            }
        };
    }

    @Nested
    @DisplayName("Startup declaration")
    class StartupTests {

        @Test
        @DisplayName("Should declare once when the broker accepts immediately")
        void shouldDeclareOnce() {
            // Given
            when(kafkaAdmin.initialize()).thenReturn(true);

            // When
            initializer.start();

            // Then
            verify(kafkaAdmin, times(1)).initialize();
            assertThat(pauses).isEmpty();
            assertThat(initializer.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Should retry with doubling, capped backoff until the broker accepts")
        void shouldRetryWithBackoff() {
            // Given
            when(kafkaAdmin.initialize()).thenReturn(false, false, false, false, true);

            // When
            initializer.start();

            // Then
            verify(kafkaAdmin, times(5)).initialize();
            assertThat(pauses).containsExactly(100L, 200L, 300L, 300L);
        }

        @Test
        @DisplayName("Should treat a declaration error as a failed attempt")
        void shouldRetryAfterError() {
            // Given
            when(kafkaAdmin.initialize())
                    .thenThrow(new KafkaException("Could not create admin"))
                    .thenReturn(true);

            // When
            initializer.start();

            // Then
            verify(kafkaAdmin, times(2)).initialize();
            assertThat(pauses).containsExactly(100L);
        }

        @Test
        @DisplayName("Should stop retrying once stopped")
        void shouldStopRetryingWhenStopped() {
            // Given
            when(kafkaAdmin.initialize()).thenReturn(false);
            BrokerTopologyInitializer stopping = new BrokerTopologyInitializer(kafkaAdmin, properties) {
                @Override
                void pause(long delayMs) {
                    stop();
                }
            };

            // When
            stopping.start();

            // Then
            verify(kafkaAdmin, times(1)).initialize();
            assertThat(stopping.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should fail startup and keep the interrupt flag when interrupted")
        void shouldPropagateInterrupt() {
            // Given
            when(kafkaAdmin.initialize()).thenReturn(false);
            BrokerTopologyInitializer interrupted = new BrokerTopologyInitializer(kafkaAdmin, properties) {
                @Override
                void pause(long delayMs) throws InterruptedException {
                    throw new InterruptedException("shutdown");
                }
            };

            // When / Then
            assertThatThrownBy(interrupted::start)
                    .isInstanceOf(IllegalStateException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.interrupted()).isTrue();
        }
    }

    @Nested
    @DisplayName("Reconnect")
    class ReconnectTests {

        @Test
        @DisplayName("Should re-declare the topology when a consumer stops polling")
        void shouldRedeclareOnNonResponsiveConsumer() {
            // Given
            when(kafkaAdmin.initialize()).thenReturn(true);

            // When
            initializer.onNonResponsiveConsumer(mock(NonResponsiveConsumerEvent.class));

            // Then
            verify(kafkaAdmin).initialize();
        }

        @Test
        @DisplayName("Should not throw from the event listener when the broker is still down")
        void shouldTolerateFailedRedeclaration() {
            // Given
            when(kafkaAdmin.initialize()).thenThrow(new KafkaException("broker unreachable"));

            // When
            initializer.onNonResponsiveConsumer(mock(NonResponsiveConsumerEvent.class));

            // Then
            verify(kafkaAdmin).initialize();
            assertThat(pauses).isEmpty();
        }
    }

    @Test
    @DisplayName("Should start before the listener containers")
    void shouldRunBeforeListenerContainers() {
        assertThat(initializer.getPhase()).isLessThan(AbstractMessageListenerContainer.DEFAULT_PHASE);
    }
}
