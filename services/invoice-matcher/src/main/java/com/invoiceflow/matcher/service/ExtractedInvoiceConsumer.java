package com.invoiceflow.matcher.service;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import com.invoiceflow.common.kafka.PipelineConsumer;

import lombok.RequiredArgsConstructor;

/**
 * Kafka consumer for invoices.extracted
 */
@Service
@RequiredArgsConstructor
public class ExtractedInvoiceConsumer {

    private final PipelineConsumer pipelineConsumer;
    private final InvoiceMatchingService matchingService;

    @KafkaListener(
        topics = "${invoiceflow.matcher.topics.extracted}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        pipelineConsumer.process(record, acknowledgment, matchingService);
    }
}
