package com.invoiceflow.common.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoicePostedEvent implements PipelineEvent {

    @NotBlank(message = "Correlation ID is required")
    private String correlationId;

    @NotNull
    private PostingStatus status;

    private String externalReference;

    private String error;
}
