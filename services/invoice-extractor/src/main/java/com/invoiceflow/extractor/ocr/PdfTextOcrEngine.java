package com.invoiceflow.extractor.ocr;

import java.io.IOException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Local fallback: reads the embedded text layer of a PDF with PDFBox.
 * Scanned images without a text layer yield blank text.
 */
@Component
@Slf4j
public class PdfTextOcrEngine implements OcrEngine {

    public static final String NAME = "pdfbox";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public OcrResult extractText(byte[] document, String filename) {
        try (PDDocument pdf = Loader.loadPDF(document)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(pdf);
            log.debug("PDFBox read {} pages from {}", pdf.getNumberOfPages(), filename);
            return OcrResult.builder()
                    .text(text == null ? "" : text.strip())
                    .engine(NAME)
                    .build();
        } catch (IOException e) {
            throw new OcrEngineException(OcrEngineException.Kind.UNSUPPORTED_DOCUMENT,
                    "Not a readable PDF: " + filename, e);
        } catch (RuntimeException e) {
            throw new OcrEngineException(OcrEngineException.Kind.ENGINE_FAILURE,
                    "PDFBox failed on " + filename + ": " + e.getMessage(), e);
        }
    }
}
