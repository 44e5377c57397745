package com.invoiceflow.extractor.ocr;

import java.util.ArrayList;
import java.util.List;

import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs OCR engines in order until one produces text.
 * <p>
 * Per engine: UNSUPPORTED_DOCUMENT and ENGINE_FAILURE move straight to the next engine,
 * TRANSIENT is retried up to the strategy's limit with exponential backoff, then falls back.
 * Blank output also falls through to the next engine.
 */
@Slf4j
public class OcrEngineChain {

    private final List<OcrStrategy> strategies;
    private final ExponentialBackOff retryBackOff;

    public OcrEngineChain(List<OcrStrategy> strategies, ExponentialBackOff retryBackOff) {
        this.strategies = List.copyOf(strategies);
        this.retryBackOff = retryBackOff;
    }

    public List<OcrStrategy> getStrategies() {
        return strategies;
    }

    /**
     * @throws OcrInterruptedException if interrupted while backing off between retries
     */
    public OcrChainResult run(byte[] document, String filename, String correlationId) {
        List<String> attempted = new ArrayList<>();
        String lastError = null;

        for (OcrStrategy strategy : strategies) {
            OcrEngine engine = strategy.getEngine();
            attempted.add(engine.name());
            BackOffExecution backOff = retryBackOff.start();

            for (int attempt = 0; attempt <= strategy.getMaxRetries(); attempt++) {
                try {
                    OcrResult result = engine.extractText(document, filename);
                    if (result != null && result.hasText()) {
                        log.info("OCR engine {} extracted {} chars for {}",
                                engine.name(), result.getText().length(), correlationId);
                        return OcrChainResult.builder()
                                .result(result)
                                .attemptedEngines(attempted)
                                .lastError(lastError)
                                .build();
                    }
                    log.warn("OCR engine {} returned no text for {}", engine.name(), correlationId);
                    lastError = engine.name() + ": no text";
                    break;
                } catch (OcrEngineException e) {
                    lastError = engine.name() + ": " + e.getMessage();
                    if (e.getKind() != OcrEngineException.Kind.TRANSIENT) {
                        log.warn("OCR engine {} cannot process {} ({}), falling back: {}",
                                engine.name(), correlationId, e.getKind(), e.getMessage());
                        break;
                    }
                    if (attempt == strategy.getMaxRetries()) {
                        log.warn("OCR engine {} still failing for {} after {} retries, falling back: {}",
                                engine.name(), correlationId, attempt, e.getMessage());
                        break;
                    }
                    long delay = backOff.nextBackOff();
                    log.warn("Transient OCR failure from {} for {} (attempt {}), retrying in {}ms: {}",
                            engine.name(), correlationId, attempt + 1, delay, e.getMessage());
                    sleep(delay);
                }
            }
        }

        return OcrChainResult.builder()
                .attemptedEngines(attempted)
                .lastError(lastError)
                .build();
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcrInterruptedException(e);
        }
    }
}
