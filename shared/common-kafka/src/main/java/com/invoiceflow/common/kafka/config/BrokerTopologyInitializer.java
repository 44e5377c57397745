package com.invoiceflow.common.kafka.config;

import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.kafka.listener.AbstractMessageListenerContainer;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Declares the pipeline topics (and their dead-letter topics) before any listener container starts,
 * retrying with exponential backoff until the broker accepts the declaration.
 * Declaration is idempotent: existing topics are left as they are.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrokerTopologyInitializer implements SmartLifecycle {

    private final KafkaAdmin kafkaAdmin;
    private final PipelineProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        BackOffExecution backOff = properties.getReconnectBackoff().toBackOff().start();
        int attempt = 1;
        while (running.get() && !declareTopology()) {
            long delay = backOff.nextBackOff();
            log.warn("Broker topology declaration failed (attempt {}), retrying in {}ms", attempt, delay);
            try {
                pause(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while declaring broker topology", e);
            }
            attempt++;
        }
        log.info("Broker topology declared after {} attempt(s)", attempt);
    }

    /**
     * A consumer that stopped polling usually means the broker connection was lost;
     * re-declare so a recreated or wiped broker gets the topics back.
     */
    @EventListener
    public void onNonResponsiveConsumer(NonResponsiveConsumerEvent event) {
        log.warn("Consumer for {} unresponsive for {}ms, re-declaring broker topology",
                event.getTopicPartitions(), event.getTimeSinceLastPoll());
        if (!declareTopology()) {
            log.warn("Broker topology re-declaration failed; the next non-responsive event will retry");
        }
    }

    void pause(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    boolean declareTopology() {
        try {
            return kafkaAdmin.initialize();
        } catch (RuntimeException e) {
            log.warn("Broker topology declaration error: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void stop() {
        running.set(false);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /** Runs just before the listener containers. */
    @Override
    public int getPhase() {
        return AbstractMessageListenerContainer.DEFAULT_PHASE - 1;
    }
}
