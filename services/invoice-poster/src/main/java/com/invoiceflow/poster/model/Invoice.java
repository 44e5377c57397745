package com.invoiceflow.poster.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.common.model.ReviewDecision;

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
 * JPA Entity for invoices table (posting columns only).
 * Invoice data and the review decision are read-only here.
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

    @Column(name = "vendor_name", length = 500, updatable = false)
    private String vendorName;

    @Column(name = "invoice_number", length = 255, updatable = false)
    private String invoiceNumber;

    @Column(name = "invoice_date", updatable = false)
    private LocalDate invoiceDate;

    @Column(name = "total_amount", precision = 14, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "currency", length = 10, updatable = false)
    private String currency;

    @Column(name = "matched_po_number", length = 100, updatable = false)
    private String matchedPoNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_decision", length = 20, updatable = false)
    private ReviewDecision reviewDecision;

    @Column(name = "reviewed_by", length = 200, updatable = false)
    private String reviewedBy;

    @Column(name = "external_reference", length = 200)
    private String externalReference;

    @Column(name = "posting_error", length = 2000)
    private String postingError;

    @Column(name = "posting_attempts")
    private Integer postingAttempts;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "posting_published", nullable = false)
    private boolean postingPublished;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30, nullable = false)
    private InvoiceStatus status;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
