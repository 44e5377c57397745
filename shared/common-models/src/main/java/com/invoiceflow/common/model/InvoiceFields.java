package com.invoiceflow.common.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured fields extracted from an invoice document.
 * Every field except the total amount may be absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceFields {

    private String vendorName;

    private String invoiceNumber;

    /** ISO-8601 date as produced by the extractor; may be unparseable. */
    private String invoiceDate;

    private String dueDate;

    @NotNull(message = "Total amount is required")
    private BigDecimal totalAmount;

    private BigDecimal subtotal;

    private BigDecimal taxAmount;

    private String currency;

    @Builder.Default
    private List<String> poNumbers = new ArrayList<>();

    @Builder.Default
    private List<LineItem> lineItems = new ArrayList<>();

    public static InvoiceFields empty() {
        return InvoiceFields.builder().build();
    }
}
