package com.invoiceflow.extractor.service;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import com.invoiceflow.common.kafka.PipelineConsumer;

import lombok.RequiredArgsConstructor;

/**
 * Kafka consumer for invoices.ingested.
 * Ack/nack and dead-lettering are applied by {@link PipelineConsumer} once the handler returns.
 */
@Service
@RequiredArgsConstructor
public class IngestedInvoiceConsumer {

    private final PipelineConsumer pipelineConsumer;
    private final InvoiceExtractionService extractionService;

    @KafkaListener(
        topics = "${invoiceflow.extractor.topics.ingested}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        pipelineConsumer.process(record, acknowledgment, extractionService);
    }
}
