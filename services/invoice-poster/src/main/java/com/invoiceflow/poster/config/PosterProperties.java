package com.invoiceflow.poster.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.invoiceflow.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the poster service
 */
@Data
@ConfigurationProperties(prefix = "invoiceflow.poster")
public class PosterProperties {

    private Topics topics = new Topics();
    private Erp erp = new Erp();

    @Data
    public static class Topics {
        private String approved = KafkaTopics.INVOICES_APPROVED;
        private String posted = KafkaTopics.INVOICES_POSTED;
    }

    @Data
    public static class Erp {
        private String baseUrl = "http://localhost:9090/api";
        private String token;
        /** Retries after the first call on 429, 5xx and network errors. */
        private int maxRetries = 3;
        private Backoff backoff = new Backoff();
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Backoff {
        private Duration initial = Duration.ofSeconds(1);
        private Duration max = Duration.ofSeconds(30);
    }
}
