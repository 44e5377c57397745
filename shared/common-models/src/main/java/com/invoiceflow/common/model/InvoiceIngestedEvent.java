package com.invoiceflow.common.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Published by the ingestion boundary once the raw document is stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceIngestedEvent implements PipelineEvent {

    @NotBlank(message = "Correlation ID is required")
    private String correlationId;

    @NotBlank(message = "Document key is required")
    private String documentKey;

    private String filename;
}
