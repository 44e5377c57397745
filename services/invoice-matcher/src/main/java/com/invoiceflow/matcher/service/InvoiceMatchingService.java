package com.invoiceflow.matcher.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.invoiceflow.common.kafka.EventPublishException;
import com.invoiceflow.common.kafka.HandlerResult;
import com.invoiceflow.common.kafka.PipelineEventPublisher;
import com.invoiceflow.common.kafka.PipelineMessageHandler;
import com.invoiceflow.common.model.ErrorText;
import com.invoiceflow.common.model.InvoiceExtractedEvent;
import com.invoiceflow.common.model.InvoiceMatchedEvent;
import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.common.model.MatchStatus;
import com.invoiceflow.common.model.MatchedDetails;
import com.invoiceflow.matcher.config.MatcherProperties;
import com.invoiceflow.matcher.model.Invoice;
import com.invoiceflow.matcher.model.MatchDecision;
import com.invoiceflow.matcher.repository.InvoiceRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Matching stage handler for invoices.extracted.
 *
 * Flow:
 * 1. Decide AUTO_APPROVED / NEEDS_REVIEW via {@link PurchaseOrderMatcher}; any error there forces NEEDS_REVIEW
 * 2. Persist the decision (PROCESSING -> decision)
 * 3. Publish to invoices.matched, mark published
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceMatchingService implements PipelineMessageHandler<InvoiceExtractedEvent> {

    private final InvoiceRepository invoiceRepository;
    private final PurchaseOrderMatcher matcher;
    private final PipelineEventPublisher publisher;
    private final MatcherProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public Class<InvoiceExtractedEvent> payloadType() {
        return InvoiceExtractedEvent.class;
    }

    @Override
    public HandlerResult handle(InvoiceExtractedEvent event) {
        UUID invoiceId;
        try {
            invoiceId = UUID.fromString(event.getCorrelationId());
        } catch (IllegalArgumentException e) {
            return HandlerResult.permanent("Correlation id is not a UUID: " + event.getCorrelationId(), e);
        }

        BigDecimal invoiceAmount = event.getFields().getTotalAmount();
        MatchDecision decision;
        try {
            decision = matcher.decide(event.getFields());
        } catch (RuntimeException e) {
            log.error("Matching failed for invoice {}, routing to review: {}", invoiceId, e.getMessage(), e);
            incrementCounter("errors");
            decision = MatchDecision.builder()
                    .status(MatchStatus.NEEDS_REVIEW)
                    .details(MatchedDetails.unmatched(invoiceAmount))
                    .error(ErrorText.bounded("Matching failed: " + e.getMessage()))
                    .build();
        }

        int updated;
        Optional<Invoice> existing = Optional.empty();
        try {
            MatchedDetails details = decision.getDetails();
            updated = invoiceRepository.recordDecision(
                    invoiceId,
                    InvoiceStatus.PROCESSING,
                    decision.getStatus().toInvoiceStatus(),
                    decision.getStatus(),
                    details.getPoNumber(),
                    details.getPoAmount(),
                    details.getVariancePct(),
                    decision.getError(),
                    Instant.now());
            if (updated == 0) {
                existing = invoiceRepository.findById(invoiceId);
            }
        } catch (DataAccessException e) {
            log.error("Could not persist match decision for {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable("Store unavailable: " + e.getMessage(), e);
        }

        if (updated == 0) {
            if (existing.isEmpty()) {
                log.error("Extracted event references unknown invoice {}", invoiceId);
                return HandlerResult.permanent("Unknown invoice " + invoiceId);
            }
            Invoice invoice = existing.get();
            if (invoice.getMatchStatus() != null && !invoice.isMatchPublished()) {
                log.info("Re-publishing match decision for invoice {} (persisted but not published)", invoiceId);
                incrementCounter("republished");
                return publishAndMark(invoiceId, toEvent(invoice));
            }
            log.info("Invoice {} not awaiting a match decision (status {}), skipping", invoiceId, invoice.getStatus());
            incrementCounter("duplicate");
            return HandlerResult.success();
        }

        log.info("Invoice {} -> {}", invoiceId, decision.getStatus());
        incrementCounter(decision.isAutoApproved() ? "auto_approved" : "needs_review");
        return publishAndMark(invoiceId, InvoiceMatchedEvent.builder()
                .correlationId(event.getCorrelationId())
                .status(decision.getStatus())
                .details(decision.getDetails())
                .error(decision.getError())
                .build());
    }

    private HandlerResult publishAndMark(UUID invoiceId, InvoiceMatchedEvent matched) {
        try {
            publisher.publish(properties.getTopics().getMatched(), matched.getCorrelationId(), matched);
        } catch (EventPublishException e) {
            log.error("Could not publish match decision for {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable(e.getMessage(), e);
        }

        try {
            invoiceRepository.markMatchPublished(invoiceId);
        } catch (DataAccessException e) {
            // event is out; a redelivery would only publish it again
            log.warn("Could not mark match of {} published: {}", invoiceId, e.getMessage());
        }
        return HandlerResult.success();
    }

    private static InvoiceMatchedEvent toEvent(Invoice invoice) {
        return InvoiceMatchedEvent.builder()
                .correlationId(invoice.getId().toString())
                .status(invoice.getMatchStatus())
                .details(MatchedDetails.builder()
                        .poNumber(invoice.getMatchedPoNumber())
                        .poAmount(invoice.getMatchedPoAmount())
                        .invoiceAmount(invoice.getTotalAmount())
                        .variancePct(invoice.getMatchVariance())
                        .build())
                .error(invoice.getMatchError())
                .build();
    }

    private void incrementCounter(String name) {
        Counter.builder("invoiceflow.matcher." + name)
                .tag("service", "invoice-matcher")
                .register(meterRegistry)
                .increment();
    }
}
