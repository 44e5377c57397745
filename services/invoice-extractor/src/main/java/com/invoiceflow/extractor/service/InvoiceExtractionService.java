package com.invoiceflow.extractor.service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceflow.common.kafka.EventPublishException;
import com.invoiceflow.common.kafka.HandlerResult;
import com.invoiceflow.common.kafka.PipelineEventPublisher;
import com.invoiceflow.common.kafka.PipelineHeaders;
import com.invoiceflow.common.kafka.PipelineMessageHandler;
import com.invoiceflow.common.model.ErrorText;
import com.invoiceflow.common.model.ExtractionStatus;
import com.invoiceflow.common.model.InvoiceExtractedEvent;
import com.invoiceflow.common.model.InvoiceFields;
import com.invoiceflow.common.model.InvoiceIngestedEvent;
import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.extractor.config.ExtractorProperties;
import com.invoiceflow.extractor.llm.FieldExtractionResult;
import com.invoiceflow.extractor.llm.FieldExtractor;
import com.invoiceflow.extractor.llm.LlmRateLimitedException;
import com.invoiceflow.extractor.model.CompletedExtraction;
import com.invoiceflow.extractor.model.Invoice;
import com.invoiceflow.extractor.model.RawOcrDocument;
import com.invoiceflow.extractor.ocr.OcrChainResult;
import com.invoiceflow.extractor.ocr.OcrEngineChain;
import com.invoiceflow.extractor.ocr.OcrInterruptedException;
import com.invoiceflow.extractor.ocr.OcrResult;
import com.invoiceflow.extractor.repository.InvoiceRepository;
import com.invoiceflow.extractor.storage.ObjectStoreClient;
import com.invoiceflow.extractor.storage.ObjectStoreException;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Extraction stage handler for invoices.ingested.
 *
 * Flow:
 * 1. Claim the invoice (PENDING -> PROCESSING), or resume a stale claim / re-publish / skip on redelivery
 * 2. Fetch the document and run the OCR chain
 * 3. Store the raw OCR output for audit
 * 4. Extract fields with the language model
 * 5. Persist, publish to invoices.extracted, mark published
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceExtractionService implements PipelineMessageHandler<InvoiceIngestedEvent> {

    static final int CORE_FIELD_COUNT = 5;

    private final InvoiceRepository invoiceRepository;
    private final ObjectStoreClient objectStore;
    private final OcrEngineChain ocrChain;
    private final FieldExtractor fieldExtractor;
    private final PipelineEventPublisher publisher;
    private final ObjectMapper objectMapper;
    private final ExtractorProperties properties;
    private final MeterRegistry meterRegistry;

    @Override
    public Class<InvoiceIngestedEvent> payloadType() {
        return InvoiceIngestedEvent.class;
    }

    @Override
    public HandlerResult handle(InvoiceIngestedEvent event) {
        UUID invoiceId;
        try {
            invoiceId = UUID.fromString(event.getCorrelationId());
        } catch (IllegalArgumentException e) {
            return HandlerResult.permanent("Correlation id is not a UUID: " + event.getCorrelationId(), e);
        }

        int claimed;
        Optional<Invoice> existing = Optional.empty();
        try {
            claimed = invoiceRepository.claimForExtraction(invoiceId, Instant.now());
            if (claimed == 0) {
                existing = invoiceRepository.findById(invoiceId);
            }
        } catch (DataAccessException e) {
            log.error("Store unavailable claiming invoice {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable("Store unavailable: " + e.getMessage(), e);
        }

        if (claimed == 0) {
            if (existing.isEmpty()) {
                log.error("Ingested event references unknown invoice {}", invoiceId);
                incrementCounter("unknown_invoice");
                return HandlerResult.permanent("Unknown invoice " + invoiceId);
            }
            Invoice invoice = existing.get();
            if (invoice.getExtractionStatus() == ExtractionStatus.COMPLETED && !invoice.isExtractionPublished()) {
                return republish(invoice);
            }
            if (invoice.getStatus() != InvoiceStatus.PROCESSING
                    || invoice.getExtractionStatus() == ExtractionStatus.COMPLETED) {
                log.info("Invoice {} already extracted (status {}), skipping", invoiceId, invoice.getStatus());
                incrementCounter("duplicate");
                return HandlerResult.success();
            }
            Optional<HandlerResult> notReclaimed = reclaim(invoiceId);
            if (notReclaimed.isPresent()) {
                return notReclaimed.get();
            }
            log.info("Resuming extraction of invoice {} after an earlier failed attempt", invoiceId);
        }

        HandlerResult result = extract(event, invoiceId);
        if (result.isRetryable()) {
            releaseClaim(invoiceId);
        }
        return result;
    }

    /**
     * Takes over an unfinished extraction. Empty when the claim was taken.
     */
    private Optional<HandlerResult> reclaim(UUID invoiceId) {
        Instant now = Instant.now();
        int reclaimed;
        try {
            reclaimed = invoiceRepository.reclaimForExtraction(invoiceId, now, now.minus(properties.getClaimLease()));
        } catch (DataAccessException e) {
            log.error("Store unavailable reclaiming invoice {}: {}", invoiceId, e.getMessage(), e);
            return Optional.of(HandlerResult.retryable("Store unavailable: " + e.getMessage(), e));
        }
        if (reclaimed == 0) {
            log.info("Invoice {} is being extracted by another delivery, backing off", invoiceId);
            incrementCounter("claim_busy");
            return Optional.of(HandlerResult.retryable("Extraction of " + invoiceId + " in progress elsewhere"));
        }
        return Optional.empty();
    }

    private void releaseClaim(UUID invoiceId) {
        try {
            invoiceRepository.releaseExtractionClaim(invoiceId);
        } catch (DataAccessException e) {
            // the claim then lapses after the lease
            log.warn("Could not release extraction claim on {}: {}", invoiceId, e.getMessage());
        }
    }

    private HandlerResult extract(InvoiceIngestedEvent event, UUID invoiceId) {
        String correlationId = event.getCorrelationId();

        byte[] document;
        try {
            document = objectStore.getObject(event.getDocumentKey());
        } catch (ObjectStoreException e) {
            log.error("Could not fetch document {} for {}: {}", event.getDocumentKey(), correlationId, e.getMessage(), e);
            return HandlerResult.retryable(e.getMessage(), e);
        }

        OcrChainResult ocr;
        try {
            ocr = ocrChain.run(document, event.getFilename(), correlationId);
        } catch (OcrInterruptedException e) {
            return HandlerResult.retryable(e.getMessage(), e);
        }

        if (!ocr.hasText()) {
            return failExtraction(invoiceId, ocr);
        }
        OcrResult ocrResult = ocr.getResult();

        String rawOcrKey = properties.getStorage().getRawOcrPrefix() + correlationId + ".json";
        try {
            storeRawOcr(rawOcrKey, event, ocr);
        } catch (ObjectStoreException e) {
            log.error("Could not store raw OCR output for {}: {}", correlationId, e.getMessage(), e);
            return HandlerResult.retryable(e.getMessage(), e);
        }

        FieldExtractionResult extraction;
        try {
            extraction = fieldExtractor.extract(ocrResult.getText(), correlationId);
        } catch (LlmRateLimitedException e) {
            log.warn("Language model rate limited for {}, will retry", correlationId);
            incrementCounter("llm_rate_limited");
            return HandlerResult.retryable(e.getMessage(), e);
        }
        if (extraction.isDegraded()) {
            incrementCounter("llm_degraded");
        }

        InvoiceFields fields = extraction.getFields();
        double confidence = confidence(fields, ocrResult.getConfidence());
        InvoiceExtractedEvent extracted = InvoiceExtractedEvent.builder()
                .correlationId(correlationId)
                .rawOcrKey(rawOcrKey)
                .fields(fields)
                .confidence(confidence)
                .truncated(extraction.isTruncated())
                .build();

        int updated;
        try {
            updated = invoiceRepository.completeExtraction(invoiceId, CompletedExtraction.builder()
                    .vendorName(fields.getVendorName())
                    .invoiceNumber(fields.getInvoiceNumber())
                    .invoiceDate(parseDate(fields.getInvoiceDate(), "invoice date", correlationId))
                    .dueDate(parseDate(fields.getDueDate(), "due date", correlationId))
                    .totalAmount(fields.getTotalAmount())
                    .subtotal(fields.getSubtotal())
                    .taxAmount(fields.getTaxAmount())
                    .currency(fields.getCurrency())
                    .poNumbersJson(toJson(fields.getPoNumbers()))
                    .extractedFieldsJson(toJson(fields))
                    .rawOcrKey(rawOcrKey)
                    .ocrEngine(ocrResult.getEngine())
                    .promptTruncated(extraction.isTruncated())
                    .confidence(confidence)
                    .failureReason(extraction.getError())
                    .build(), Instant.now());
        } catch (DataAccessException e) {
            log.error("Could not persist extraction for {}: {}", correlationId, e.getMessage(), e);
            return HandlerResult.retryable("Store unavailable: " + e.getMessage(), e);
        }

        if (updated == 0) {
            log.info("Extraction for {} already persisted by a concurrent delivery, not publishing", correlationId);
            incrementCounter("duplicate");
            return HandlerResult.success();
        }

        log.info("Persisted extraction for {} via {} (confidence {}, truncated {})",
                correlationId, ocrResult.getEngine(), confidence, extraction.isTruncated());
        incrementCounter("extracted");
        return publishAndMark(invoiceId, extracted);
    }

    private HandlerResult failExtraction(UUID invoiceId, OcrChainResult ocr) {
        String reason = ErrorText.bounded("No text extracted by " + String.join(", ", ocr.getAttemptedEngines())
                + (ocr.getLastError() != null ? " (last error: " + ocr.getLastError() + ")" : ""));
        try {
            int updated = invoiceRepository.markFailed(invoiceId, reason, Instant.now());
            if (updated == 0) {
                log.info("Invoice {} left PROCESSING before it could be marked failed", invoiceId);
            }
        } catch (DataAccessException e) {
            log.error("Could not mark invoice {} failed: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable("Store unavailable: " + e.getMessage(), e);
        }
        log.warn("Extraction failed for invoice {}: {}", invoiceId, reason);
        incrementCounter("ocr_empty");
        return HandlerResult.success();
    }

    private HandlerResult republish(Invoice invoice) {
        InvoiceFields fields;
        try {
            fields = invoice.getExtractedFields() == null
                    ? InvoiceFields.empty()
                    : objectMapper.readValue(invoice.getExtractedFields(), InvoiceFields.class);
        } catch (JsonProcessingException e) {
            return HandlerResult.permanent("Stored extraction for " + invoice.getId() + " is unreadable", e);
        }

        log.info("Re-publishing extraction for invoice {} (persisted but not published)", invoice.getId());
        incrementCounter("republished");
        return publishAndMark(invoice.getId(), InvoiceExtractedEvent.builder()
                .correlationId(invoice.getId().toString())
                .rawOcrKey(invoice.getRawOcrKey())
                .fields(fields)
                .confidence(invoice.getExtractionConfidence())
                .truncated(invoice.getPromptTruncated())
                .build());
    }

    private HandlerResult publishAndMark(UUID invoiceId, InvoiceExtractedEvent extracted) {
        try {
            publisher.publish(properties.getTopics().getExtracted(), extracted.getCorrelationId(), extracted);
        } catch (EventPublishException e) {
            log.error("Could not publish extraction for {}: {}", invoiceId, e.getMessage(), e);
            return HandlerResult.retryable(e.getMessage(), e);
        }

        try {
            invoiceRepository.markExtractionPublished(invoiceId);
        } catch (DataAccessException e) {
            // event is out; a redelivery would only publish it again
            log.warn("Could not mark extraction of {} published: {}", invoiceId, e.getMessage());
        }
        return HandlerResult.success();
    }

    private void storeRawOcr(String key, InvoiceIngestedEvent event, OcrChainResult ocr) {
        RawOcrDocument raw = RawOcrDocument.builder()
                .correlationId(event.getCorrelationId())
                .text(ocr.getResult().getText())
                .confidence(ocr.getResult().getConfidence())
                .engine(ocr.getResult().getEngine())
                .attemptedEngines(ocr.getAttemptedEngines())
                .filename(event.getFilename())
                .extractedAt(Instant.now().toString())
                .build();
        objectStore.putObject(key, toJson(raw).getBytes(StandardCharsets.UTF_8), PipelineHeaders.APPLICATION_JSON);
    }

    /**
     * Share of the five core fields present, scaled by the OCR engine's confidence (1 when unknown).
     */
    static double confidence(InvoiceFields fields, Double ocrConfidence) {
        int present = 0;
        if (fields.getVendorName() != null) {
            present++;
        }
        if (fields.getInvoiceNumber() != null) {
            present++;
        }
        if (fields.getInvoiceDate() != null) {
            present++;
        }
        if (fields.getTotalAmount() != null) {
            present++;
        }
        if (fields.getPoNumbers() != null && !fields.getPoNumbers().isEmpty()) {
            present++;
        }
        double ocrFactor = ocrConfidence != null ? ocrConfidence : 1.0;
        return ((double) present / CORE_FIELD_COUNT) * ocrFactor;
    }

    private static LocalDate parseDate(String value, String label, String correlationId) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable {} '{}' for {}, storing null", label, value, correlationId);
            return null;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private void incrementCounter(String name) {
        Counter.builder("invoiceflow.extractor." + name)
                .tag("service", "invoice-extractor")
                .register(meterRegistry)
                .increment();
    }
}
