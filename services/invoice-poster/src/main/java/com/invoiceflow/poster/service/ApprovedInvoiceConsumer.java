package com.invoiceflow.poster.service;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import com.invoiceflow.common.kafka.PipelineConsumer;

import lombok.RequiredArgsConstructor;

/**
 * Kafka consumer for invoices.approved, published by the review API.
 */
@Service
@RequiredArgsConstructor
public class ApprovedInvoiceConsumer {

    private final PipelineConsumer pipelineConsumer;
    private final InvoicePostingService postingService;

    @KafkaListener(
        topics = "${invoiceflow.poster.topics.approved}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        pipelineConsumer.process(record, acknowledgment, postingService);
    }
}
