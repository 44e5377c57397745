package com.invoiceflow.extractor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.invoiceflow.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the extractor service
 */
@Data
@ConfigurationProperties(prefix = "invoiceflow.extractor")
public class ExtractorProperties {

    private Topics topics = new Topics();
    private Storage storage = new Storage();
    private Ocr ocr = new Ocr();
    private Llm llm = new Llm();

    /** How long an unfinished extraction claim blocks redeliveries of the same invoice. */
    private Duration claimLease = Duration.ofSeconds(60);

    @Data
    public static class Topics {
        private String ingested = KafkaTopics.INVOICES_INGESTED;
        private String extracted = KafkaTopics.INVOICES_EXTRACTED;
    }

    @Data
    public static class Storage {
        private String bucket = "invoiceflow-documents";
        private String region = "us-east-1";
        /** Optional endpoint override, e.g. a local S3-compatible store. */
        private String endpoint;
        private boolean pathStyleAccess = false;
        private String rawOcrPrefix = "raw-ocr/";
        private Duration apiCallTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Ocr {
        private int primaryMaxRetries = 2;
        private boolean fallbackEnabled = true;
        private Duration retryInitialBackoff = Duration.ofSeconds(1);
        private Duration retryMaxBackoff = Duration.ofSeconds(10);
        private Duration apiCallTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Llm {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double temperature = 0.0;
        private int maxTokens = 2000;
        private int maxPromptChars = 8000;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }
}
