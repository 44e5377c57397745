package com.invoiceflow.extractor.ocr;

public class OcrInterruptedException extends RuntimeException {

    public OcrInterruptedException(InterruptedException cause) {
        super("Interrupted during OCR retry backoff", cause);
    }
}
