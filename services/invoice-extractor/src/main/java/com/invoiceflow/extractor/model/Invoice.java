package com.invoiceflow.extractor.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import com.invoiceflow.common.model.ExtractionStatus;
import com.invoiceflow.common.model.InvoiceStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for invoices table (extraction columns only).
 * Rows are created by the ingestion boundary; the extractor only updates them.
 */
@Entity
@Table(name = "invoices")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Invoice {

    @Id
    @Column(name = "id", columnDefinition = "uuid", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "filename", length = 500)
    private String filename;

    @Column(name = "document_key", length = 1000)
    private String documentKey;

    @Column(name = "vendor_name", length = 500)
    private String vendorName;

    @Column(name = "invoice_number", length = 255)
    private String invoiceNumber;

    @Column(name = "invoice_date")
    private LocalDate invoiceDate;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "total_amount", precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "subtotal", precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", precision = 14, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "currency", length = 10)
    private String currency;

    /** JSON array of candidate PO references. */
    @Column(name = "po_numbers", columnDefinition = "text")
    private String poNumbers;

    /** Full extracted field set as JSON, used to re-publish after a lost publish. */
    @Column(name = "extracted_fields", columnDefinition = "text")
    private String extractedFields;

    @Column(name = "raw_ocr_key", length = 1000)
    private String rawOcrKey;

    @Column(name = "ocr_engine", length = 50)
    private String ocrEngine;

    @Column(name = "prompt_truncated")
    private Boolean promptTruncated;

    @Column(name = "extraction_confidence")
    private Double extractionConfidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "extraction_status", length = 20)
    private ExtractionStatus extractionStatus;

    /** When the current extraction attempt started; null once released. */
    @Column(name = "extraction_claimed_at")
    private Instant extractionClaimedAt;

    @Column(name = "failure_reason", length = 2000)
    private String failureReason;

    @Column(name = "extraction_published", nullable = false)
    private boolean extractionPublished;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30, nullable = false)
    private InvoiceStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
