package com.invoiceflow.common.model;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Detail of a matching decision. PO fields are null when no purchase order was found.
 * {@code variancePct} is a signed fraction, so 0.02 means 2%.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchedDetails {

    private String poNumber;

    private BigDecimal poAmount;

    private BigDecimal invoiceAmount;

    private BigDecimal variancePct;

    public static MatchedDetails unmatched(BigDecimal invoiceAmount) {
        return MatchedDetails.builder().invoiceAmount(invoiceAmount).build();
    }
}
