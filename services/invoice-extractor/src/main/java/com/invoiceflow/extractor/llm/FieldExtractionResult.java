package com.invoiceflow.extractor.llm;

import com.invoiceflow.common.model.ErrorText;
import com.invoiceflow.common.model.InvoiceFields;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FieldExtractionResult {

    InvoiceFields fields;

    /** Whether the OCR text was cut to fit the prompt budget. */
    boolean truncated;

    /** Why extraction degraded to empty fields; null on success. */
    String error;

    public boolean isDegraded() {
        return error != null;
    }

    public static FieldExtractionResult degraded(boolean truncated, String error) {
        return FieldExtractionResult.builder()
                .fields(InvoiceFields.empty())
                .truncated(truncated)
                .error(ErrorText.bounded(error))
                .build();
    }
}
