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
public class InvoiceMatchedEvent implements PipelineEvent {

    @NotBlank(message = "Correlation ID is required")
    private String correlationId;

    @NotNull
    private MatchStatus status;

    private MatchedDetails details;

    private String error;
}
