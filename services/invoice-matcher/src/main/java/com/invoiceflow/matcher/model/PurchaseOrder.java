package com.invoiceflow.matcher.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import org.hibernate.annotations.Immutable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for purchase_orders table (read-only; loaded by the procurement feed).
 * {@code poNumber} is stored normalized: trimmed and upper-cased.
 */
@Entity
@Immutable
@Table(name = "purchase_orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseOrder {

    @Id
    @Column(name = "id", columnDefinition = "uuid", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "po_number", length = 100, nullable = false, unique = true)
    private String poNumber;

    @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "order_date")
    private LocalDate orderDate;

    @Column(name = "vendor_name", length = 500)
    private String vendorName;
}
