package com.invoiceflow.extractor.llm;

public interface FieldExtractor {

    /**
     * Extracts structured invoice fields from OCR text. Provider errors other than
     * rate limiting degrade to an empty result rather than failing.
     *
     * @throws LlmRateLimitedException when the provider is rate limiting
     */
    FieldExtractionResult extract(String text, String correlationId);
}
