package com.invoiceflow.matcher.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.common.model.MatchStatus;

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
 * JPA Entity for invoices table (matching columns only)
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

    @Column(name = "total_amount", precision = 14, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_status", length = 20)
    private MatchStatus matchStatus;

    @Column(name = "matched_po_number", length = 100)
    private String matchedPoNumber;

    @Column(name = "matched_po_amount", precision = 14, scale = 2)
    private BigDecimal matchedPoAmount;

    @Column(name = "match_variance", precision = 19, scale = 6)
    private BigDecimal matchVariance;

    @Column(name = "match_error", length = 2000)
    private String matchError;

    @Column(name = "matched_at")
    private Instant matchedAt;

    @Column(name = "match_published", nullable = false)
    private boolean matchPublished;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30, nullable = false)
    private InvoiceStatus status;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
