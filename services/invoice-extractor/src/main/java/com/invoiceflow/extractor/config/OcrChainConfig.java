package com.invoiceflow.extractor.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.backoff.ExponentialBackOff;

import com.invoiceflow.extractor.ocr.OcrEngineChain;
import com.invoiceflow.extractor.ocr.OcrStrategy;
import com.invoiceflow.extractor.ocr.PdfTextOcrEngine;
import com.invoiceflow.extractor.ocr.TextractOcrEngine;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class OcrChainConfig {

    @Bean
    public OcrEngineChain ocrEngineChain(TextractOcrEngine textract, PdfTextOcrEngine pdfText,
            ExtractorProperties properties) {
        ExtractorProperties.Ocr ocr = properties.getOcr();

        List<OcrStrategy> strategies = new ArrayList<>();
        strategies.add(new OcrStrategy(textract, ocr.getPrimaryMaxRetries()));
        if (ocr.isFallbackEnabled()) {
            strategies.add(new OcrStrategy(pdfText, 0));
        }

        ExponentialBackOff backOff = new ExponentialBackOff(ocr.getRetryInitialBackoff().toMillis(), 2.0);
        backOff.setMaxInterval(ocr.getRetryMaxBackoff().toMillis());

        log.info("OCR chain: {} (primary retries {})",
                strategies.stream().map(s -> s.getEngine().name()).toList(), ocr.getPrimaryMaxRetries());
        return new OcrEngineChain(strategies, backOff);
    }
}
