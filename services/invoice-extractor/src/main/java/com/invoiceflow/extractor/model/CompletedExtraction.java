package com.invoiceflow.extractor.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.Builder;
import lombok.Value;

/**
 * Column values written when an extraction completes.
 */
@Value
@Builder
public class CompletedExtraction {
    String vendorName;
    String invoiceNumber;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal totalAmount;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    String currency;
    String poNumbersJson;
    String extractedFieldsJson;
    String rawOcrKey;
    String ocrEngine;
    boolean promptTruncated;
    double confidence;
    String failureReason;
}
