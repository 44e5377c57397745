package com.invoiceflow.common.kafka.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import com.invoiceflow.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties shared by every pipeline consumer process.
 */
@Data
@ConfigurationProperties(prefix = "invoiceflow.pipeline")
public class PipelineProperties {

    /** Reported in the source_service header and used to scope delivery counters. */
    private String serviceName = "invoiceflow";

    /** Maximum number of concurrently executing handlers per consumer process. */
    private int prefetchLimit = 10;

    /** Retryable failures beyond this many attempts are dead-lettered. */
    private int maxRedeliveries = 5;

    private Backoff redeliveryBackoff = new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));

    private Backoff reconnectBackoff = new Backoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60));

    private Duration publishTimeout = Duration.ofSeconds(10);

    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    private Topology topology = new Topology();

    @Data
    public static class Backoff {
        private Duration initial;
        private double multiplier;
        private Duration max;

        public Backoff() {
            this(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
        }

        public Backoff(Duration initial, double multiplier, Duration max) {
            this.initial = initial;
            this.multiplier = multiplier;
            this.max = max;
        }

        public ExponentialBackOff toBackOff() {
            ExponentialBackOff backOff = new ExponentialBackOff(initial.toMillis(), multiplier);
            backOff.setMaxInterval(max.toMillis());
            return backOff;
        }

        /**
         * Delay before the given (1-based) attempt: initial * multiplier^(attempt-1), capped at max.
         */
        public Duration delayForAttempt(int attempt) {
            BackOffExecution execution = toBackOff().start();
            long delay = execution.nextBackOff();
            for (int i = 1; i < attempt; i++) {
                delay = execution.nextBackOff();
            }
            return Duration.ofMillis(delay);
        }
    }

    @Data
    public static class Topology {
        private int partitions = 3;
        private short replicas = 1;
        private List<String> topics = new ArrayList<>(KafkaTopics.PIPELINE_TOPICS);
        private boolean declareDeadLetterTopics = true;
    }
}
