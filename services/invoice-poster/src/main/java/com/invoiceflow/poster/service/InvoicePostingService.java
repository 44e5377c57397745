package com.invoiceflow.poster.service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.invoiceflow.common.kafka.EventPublishException;
import com.invoiceflow.common.kafka.HandlerResult;
import com.invoiceflow.common.kafka.PipelineEventPublisher;
import com.invoiceflow.common.kafka.PipelineMessageHandler;
import com.invoiceflow.common.model.InvoiceApprovedEvent;
import com.invoiceflow.common.model.InvoicePostedEvent;
import com.invoiceflow.common.model.PostingStatus;
import com.invoiceflow.common.model.ReviewDecision;
import com.invoiceflow.poster.config.PosterProperties;
import com.invoiceflow.poster.erp.ErpClient;
import com.invoiceflow.poster.erp.ErpInterruptedException;
import com.invoiceflow.poster.erp.ErpInvoicePayload;
import com.invoiceflow.poster.erp.ErpPostingOutcome;
import com.invoiceflow.poster.model.Invoice;
import com.invoiceflow.poster.repository.InvoiceRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Posting stage handler for invoices.approved.
 *
 * Flow:
 * 1. Load the invoice; only REVIEWED + APPROVED is posted, finished postings are re-published or skipped
 * 2. Post to the ERP (retries happen inside {@link ErpClient})
 * 3. Persist POSTED / POSTING_FAILED (REVIEWED -> outcome)
 * 4. Publish to invoices.posted, mark published
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePostingService implements PipelineMessageHandler<InvoiceApprovedEvent> {

    private final InvoiceRepository invoiceRepository;
    private final ErpClient erpClient;
    private final PipelineEventPublisher publisher;
    private final PosterProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public Class<InvoiceApprovedEvent> payloadType() {
        return InvoiceApprovedEvent.class;
    }

    @Override
    public HandlerResult handle(InvoiceApprovedEvent event) {
        UUID invoiceId;
        try {
            invoiceId = UUID.fromString(event.getCorrelationId());
        } catch (IllegalArgumentException e) {
            return HandlerResult.permanent("Correlation id is not a UUID: " + event.getCorrelationId(), e);
        }

        Optional<Invoice> found;
        try {
            found = invoiceRepository.findById(invoiceId);
        } catch (DataAccessException e) {
            log.error("Store unavailable loading invoice {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable("Store unavailable: " + e.getMessage(), e);
        }
        if (found.isEmpty()) {
            log.error("Approved event references unknown invoice {}", invoiceId);
            return HandlerResult.permanent("Unknown invoice " + invoiceId);
        }
        Invoice invoice = found.get();

        switch (invoice.getStatus()) {
            case POSTED:
            case POSTING_FAILED:
                if (invoice.isPostingPublished()) {
                    log.info("Invoice {} already {}, skipping", invoiceId, invoice.getStatus());
                    incrementCounter("duplicate");
                    return HandlerResult.success();
                }
                log.info("Re-publishing posting outcome for invoice {} (persisted but not published)", invoiceId);
                incrementCounter("republished");
                return publishAndMark(invoiceId, toEvent(invoice));
            case REVIEWED:
                if (invoice.getReviewDecision() == ReviewDecision.REJECTED) {
                    log.info("Invoice {} was rejected by {}, not posting", invoiceId, invoice.getReviewedBy());
                    incrementCounter("rejected");
                    return HandlerResult.success();
                }
                if (invoice.getReviewDecision() != ReviewDecision.APPROVED) {
                    return HandlerResult.permanent("Invoice " + invoiceId + " is REVIEWED without a decision");
                }
                return post(invoice, event);
            default:
                log.error("Approved event for invoice {} in status {}", invoiceId, invoice.getStatus());
                return HandlerResult.permanent("Invoice " + invoiceId + " not reviewed (status "
                        + invoice.getStatus() + ")");
        }
    }

    private HandlerResult post(Invoice invoice, InvoiceApprovedEvent event) {
        UUID invoiceId = invoice.getId();
        log.info("Posting invoice {} approved by {}", invoiceId, event.getApprovedBy());

        ErpPostingOutcome outcome;
        try {
            outcome = erpClient.post(toPayload(invoice), event.getCorrelationId());
        } catch (ErpInterruptedException e) {
            return HandlerResult.retryable(e.getMessage(), e);
        }

        int updated;
        try {
            Instant now = Instant.now();
            updated = outcome.isPosted()
                    ? invoiceRepository.markPosted(invoiceId, outcome.getExternalReference(), outcome.getAttempts(), now)
                    : invoiceRepository.markPostingFailed(invoiceId, outcome.getError(), outcome.getAttempts(), now);
        } catch (DataAccessException e) {
            // a redelivery posts again under the same idempotency key
            log.error("Could not persist posting outcome for {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable("Store unavailable: " + e.getMessage(), e);
        }

        if (updated == 0) {
            log.info("Posting outcome for {} already persisted by a concurrent delivery, not publishing", invoiceId);
            incrementCounter("duplicate");
            return HandlerResult.success();
        }

        PostingStatus status = outcome.isPosted() ? PostingStatus.POSTED : PostingStatus.POSTING_FAILED;
        log.info("Invoice {} -> {} after {} ERP call(s)", invoiceId, status, outcome.getAttempts());
        incrementCounter(outcome.isPosted() ? "posted" : "posting_failed");
        return publishAndMark(invoiceId, InvoicePostedEvent.builder()
                .correlationId(event.getCorrelationId())
                .status(status)
                .externalReference(outcome.getExternalReference())
                .error(outcome.getError())
                .build());
    }

    private HandlerResult publishAndMark(UUID invoiceId, InvoicePostedEvent posted) {
        try {
            publisher.publish(properties.getTopics().getPosted(), posted.getCorrelationId(), posted);
        } catch (EventPublishException e) {
            log.error("Could not publish posting outcome for {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable(e.getMessage(), e);
        }

        try {
            invoiceRepository.markPostingPublished(invoiceId);
        } catch (DataAccessException e) {
            // event is out; a redelivery would only publish it again
            log.warn("Could not mark posting of {} published: {}", invoiceId, e.getMessage());
        }
        return HandlerResult.success();
    }

    static ErpInvoicePayload toPayload(Invoice invoice) {
        return ErpInvoicePayload.builder()
                .id(invoice.getId().toString())
                .vendor(invoice.getVendorName())
                .invoiceNumber(invoice.getInvoiceNumber())
                .invoiceDate(invoice.getInvoiceDate() != null ? invoice.getInvoiceDate().toString() : null)
                .amount(invoice.getTotalAmount() != null ? invoice.getTotalAmount().toPlainString() : null)
                .currency(invoice.getCurrency())
                .poNumber(invoice.getMatchedPoNumber())
                .build();
    }

    private static InvoicePostedEvent toEvent(Invoice invoice) {
        return InvoicePostedEvent.builder()
                .correlationId(invoice.getId().toString())
                .status(PostingStatus.valueOf(invoice.getStatus().name()))
                .externalReference(invoice.getExternalReference())
                .error(invoice.getPostingError())
                .build();
    }

    private void incrementCounter(String name) {
        Counter.builder("invoiceflow.poster." + name)
                .tag("service", "invoice-poster")
                .register(meterRegistry)
                .increment();
    }
}
