package com.invoiceflow.matcher.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.invoiceflow.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the matcher service
 */
@Data
@ConfigurationProperties(prefix = "invoiceflow.matcher")
public class MatcherProperties {

    /** Largest |invoice - PO| / PO that is still auto-approved; 0.02 means 2%. */
    private BigDecimal tolerance = new BigDecimal("0.02");

    private Topics topics = new Topics();

    @Data
    public static class Topics {
        private String extracted = KafkaTopics.INVOICES_EXTRACTED;
        private String matched = KafkaTopics.INVOICES_MATCHED;
    }
}
