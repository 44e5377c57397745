package com.invoiceflow.extractor.ocr;

import lombok.Value;

/**
 * An engine together with how many times a transient failure may be retried before falling back.
 */
@Value
public class OcrStrategy {
    OcrEngine engine;
    int maxRetries;
}
