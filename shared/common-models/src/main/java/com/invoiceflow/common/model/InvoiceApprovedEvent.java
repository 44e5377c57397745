package com.invoiceflow.common.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Published by the review API after a human or auto-approval acknowledgment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceApprovedEvent implements PipelineEvent {

    @NotBlank(message = "Correlation ID is required")
    private String correlationId;

    private String approvedBy;
}
