package com.invoiceflow.extractor.ocr;

/**
 * One text-recognition engine in the OCR fallback chain.
 */
public interface OcrEngine {

    /** Short identifier recorded on the invoice, e.g. {@code textract}. */
    String name();

    /**
     * @throws OcrEngineException classified so the chain can decide between retry and fallback
     */
    OcrResult extractText(byte[] document, String filename);
}
