package com.invoiceflow.poster.erp;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed ERP request body. Amount is a decimal string, dates are ISO-8601.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErpInvoicePayload {

    private String id;

    private String vendor;

    @JsonProperty("invoice_number")
    private String invoiceNumber;

    @JsonProperty("invoice_date")
    private String invoiceDate;

    private String amount;

    private String currency;

    @JsonProperty("po_number")
    private String poNumber;
}
