package com.invoiceflow.extractor.ocr;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OcrChainResult {

    /** The first non-blank result, or null when every engine came up empty. */
    OcrResult result;

    List<String> attemptedEngines;

    /** Last engine error seen, for the failure reason when nothing succeeded. */
    String lastError;

    public boolean hasText() {
        return result != null && result.hasText();
    }
}
