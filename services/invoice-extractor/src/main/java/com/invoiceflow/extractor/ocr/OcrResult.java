package com.invoiceflow.extractor.ocr;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OcrResult {

    String text;

    /** Mean engine confidence in [0, 1]; null when the engine reports none. */
    Double confidence;

    String engine;

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
