package com.invoiceflow.common.model;

import jakarta.validation.Valid;
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
public class InvoiceExtractedEvent implements PipelineEvent {

    @NotBlank(message = "Correlation ID is required")
    private String correlationId;

    private String rawOcrKey;

    @Valid
    @NotNull(message = "Fields are required")
    private InvoiceFields fields;

    private Double confidence;

    private Boolean truncated;
}
