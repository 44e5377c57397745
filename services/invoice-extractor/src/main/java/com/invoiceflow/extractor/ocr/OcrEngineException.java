package com.invoiceflow.extractor.ocr;

import lombok.Getter;

/**
 * Failure of a single OCR engine invocation.
 */
@Getter
public class OcrEngineException extends RuntimeException {

    private final Kind kind;

    public OcrEngineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public OcrEngineException(Kind kind, String message) {
        this(kind, message, null);
    }

    public enum Kind {
        /** The engine cannot read this document; retrying will not help. */
        UNSUPPORTED_DOCUMENT,
        /** Throttling, timeouts and service-side errors. */
        TRANSIENT,
        /** Anything else the engine reports. */
        ENGINE_FAILURE
    }
}
