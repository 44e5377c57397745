package com.invoiceflow.extractor.repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.invoiceflow.common.model.ExtractionStatus;
import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.extractor.model.CompletedExtraction;
import com.invoiceflow.extractor.model.Invoice;

/**
 * Conditional writes for the extraction stage. Each returns the number of rows
 * affected; zero means the guard did not hold.
 */
@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.status = :processing, i.extractionStatus = :extractionProcessing, "
            + "i.extractionClaimedAt = :now, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.status = :pending")
    int claim(
            @Param("id") UUID id,
            @Param("now") Instant now,
            @Param("pending") InvoiceStatus pending,
            @Param("processing") InvoiceStatus processing,
            @Param("extractionProcessing") ExtractionStatus extractionProcessing);

    /**
     * PENDING -> PROCESSING, with the extraction sub-state set to PROCESSING and the claim stamped.
     */
    default int claimForExtraction(UUID id, Instant now) {
        return claim(id, now, InvoiceStatus.PENDING, InvoiceStatus.PROCESSING, ExtractionStatus.PROCESSING);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.extractionClaimedAt = :now, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.status = :processing AND i.extractionStatus = :extractionProcessing "
            + "AND (i.extractionClaimedAt IS NULL OR i.extractionClaimedAt < :staleBefore)")
    int reclaim(
            @Param("id") UUID id,
            @Param("now") Instant now,
            @Param("staleBefore") Instant staleBefore,
            @Param("processing") InvoiceStatus processing,
            @Param("extractionProcessing") ExtractionStatus extractionProcessing);

    /**
     * Takes over an unfinished extraction whose claim was released or is older than
     * {@code staleBefore}. Zero while another delivery still holds a live claim.
     */
    default int reclaimForExtraction(UUID id, Instant now, Instant staleBefore) {
        return reclaim(id, now, staleBefore, InvoiceStatus.PROCESSING, ExtractionStatus.PROCESSING);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.extractionClaimedAt = NULL "
            + "WHERE i.id = :id AND i.status = :processing AND i.extractionStatus = :extractionProcessing")
    int releaseClaim(
            @Param("id") UUID id,
            @Param("processing") InvoiceStatus processing,
            @Param("extractionProcessing") ExtractionStatus extractionProcessing);

    /**
     * Clears the claim after a retryable failure so the redelivery can resume at once.
     */
    default int releaseExtractionClaim(UUID id) {
        return releaseClaim(id, InvoiceStatus.PROCESSING, ExtractionStatus.PROCESSING);
    }

    /**
     * Stores the extracted fields once. Guarded on PROCESSING and on the extraction
     * not having completed already, so a concurrent duplicate loses.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET "
            + "i.vendorName = :vendorName, i.invoiceNumber = :invoiceNumber, "
            + "i.invoiceDate = :invoiceDate, i.dueDate = :dueDate, "
            + "i.totalAmount = :totalAmount, i.subtotal = :subtotal, i.taxAmount = :taxAmount, "
            + "i.currency = :currency, i.poNumbers = :poNumbers, i.extractedFields = :extractedFields, "
            + "i.rawOcrKey = :rawOcrKey, i.ocrEngine = :ocrEngine, i.promptTruncated = :promptTruncated, "
            + "i.extractionConfidence = :confidence, i.failureReason = :failureReason, "
            + "i.extractionStatus = :completed, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.status = :processing "
            + "AND (i.extractionStatus IS NULL OR i.extractionStatus <> :completed)")
    int completeExtraction(
            @Param("id") UUID id,
            @Param("vendorName") String vendorName,
            @Param("invoiceNumber") String invoiceNumber,
            @Param("invoiceDate") LocalDate invoiceDate,
            @Param("dueDate") LocalDate dueDate,
            @Param("totalAmount") BigDecimal totalAmount,
            @Param("subtotal") BigDecimal subtotal,
            @Param("taxAmount") BigDecimal taxAmount,
            @Param("currency") String currency,
            @Param("poNumbers") String poNumbers,
            @Param("extractedFields") String extractedFields,
            @Param("rawOcrKey") String rawOcrKey,
            @Param("ocrEngine") String ocrEngine,
            @Param("promptTruncated") Boolean promptTruncated,
            @Param("confidence") Double confidence,
            @Param("failureReason") String failureReason,
            @Param("now") Instant now,
            @Param("processing") InvoiceStatus processing,
            @Param("completed") ExtractionStatus completed);

    default int completeExtraction(UUID id, CompletedExtraction extraction, Instant now) {
        return completeExtraction(id,
                extraction.getVendorName(),
                extraction.getInvoiceNumber(),
                extraction.getInvoiceDate(),
                extraction.getDueDate(),
                extraction.getTotalAmount(),
                extraction.getSubtotal(),
                extraction.getTaxAmount(),
                extraction.getCurrency(),
                extraction.getPoNumbersJson(),
                extraction.getExtractedFieldsJson(),
                extraction.getRawOcrKey(),
                extraction.getOcrEngine(),
                extraction.isPromptTruncated(),
                extraction.getConfidence(),
                extraction.getFailureReason(),
                now,
                InvoiceStatus.PROCESSING,
                ExtractionStatus.COMPLETED);
    }

    /**
     * PROCESSING -> FAILED when no text could be recovered from the document.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.status = :failed, i.extractionStatus = :extractionFailed, "
            + "i.failureReason = :reason, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.status = :processing")
    int markFailed(
            @Param("id") UUID id,
            @Param("reason") String reason,
            @Param("now") Instant now,
            @Param("processing") InvoiceStatus processing,
            @Param("failed") InvoiceStatus failed,
            @Param("extractionFailed") ExtractionStatus extractionFailed);

    default int markFailed(UUID id, String reason, Instant now) {
        return markFailed(id, reason, now, InvoiceStatus.PROCESSING, InvoiceStatus.FAILED, ExtractionStatus.FAILED);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.extractionPublished = true WHERE i.id = :id")
    int markExtractionPublished(@Param("id") UUID id);
}
