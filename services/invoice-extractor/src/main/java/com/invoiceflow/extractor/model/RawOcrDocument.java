package com.invoiceflow.extractor.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit copy of the OCR output, stored as JSON under {@code raw-ocr/<correlationId>.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawOcrDocument {
    private String correlationId;
    private String text;
    private Double confidence;
    private String engine;
    private List<String> attemptedEngines;
    private String filename;
    private String extractedAt;
}
