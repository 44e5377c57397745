package com.invoiceflow.matcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * InvoiceFlow Matcher Service - purchase-order reconciliation
 *
 * Responsibilities:
 * - Consume extracted invoices from invoices.extracted
 * - Look up candidate purchase orders and compute the amount variance
 * - Decide AUTO_APPROVED or NEEDS_REVIEW (PROCESSING -> decision)
 * - Publish the decision to invoices.matched
 */
@SpringBootApplication(scanBasePackages = "com.invoiceflow")
@EntityScan("com.invoiceflow")
@EnableJpaRepositories("com.invoiceflow")
@EnableKafka
@ConfigurationPropertiesScan
public class MatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatcherApplication.class, args);
    }
}
