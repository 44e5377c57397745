package com.invoiceflow.poster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * InvoiceFlow Poster Service - ERP posting
 *
 * Responsibilities:
 * - Consume approvals from invoices.approved
 * - Post approved invoices to the ERP with bounded local retries
 * - Record POSTED / POSTING_FAILED (REVIEWED -> outcome)
 * - Publish the outcome to invoices.posted
 */
@SpringBootApplication(scanBasePackages = "com.invoiceflow")
@EntityScan("com.invoiceflow")
@EnableJpaRepositories("com.invoiceflow")
@EnableKafka
@ConfigurationPropertiesScan
public class PosterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosterApplication.class, args);
    }
}
