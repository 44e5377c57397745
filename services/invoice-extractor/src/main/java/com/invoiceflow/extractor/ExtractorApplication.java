package com.invoiceflow.extractor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * InvoiceFlow Extractor Service - OCR and field extraction
 *
 * Responsibilities:
 * - Consume ingested invoices from invoices.ingested
 * - Fetch the document from the object store and run the OCR fallback chain
 * - Store the raw OCR output for audit
 * - Extract structured fields with the language model
 * - Persist the fields and publish to invoices.extracted
 */
@SpringBootApplication(scanBasePackages = "com.invoiceflow")
@EntityScan("com.invoiceflow")
@EnableJpaRepositories("com.invoiceflow")
@EnableKafka
@ConfigurationPropertiesScan
public class ExtractorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExtractorApplication.class, args);
    }
}
