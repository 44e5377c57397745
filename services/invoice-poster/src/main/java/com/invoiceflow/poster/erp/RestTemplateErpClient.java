package com.invoiceflow.poster.erp;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceflow.poster.config.PosterProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * ERP client over {@code POST {base-url}/invoices}.
 * <p>
 * 2xx posts; 429, 5xx and I/O errors are retried up to {@code erp.max-retries} times with
 * exponential backoff. Any other status, including redirects and codes outside the
 * {@link org.springframework.http.HttpStatus} enum, is a final rejection.
 */
@Component
@Slf4j
public class RestTemplateErpClient implements ErpClient {

    static final String INVOICES_PATH = "/invoices";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PosterProperties.Erp erp;
    private final ExponentialBackOff retryBackOff;

    public RestTemplateErpClient(
            @Qualifier("erpRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            PosterProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.erp = properties.getErp();
        this.retryBackOff = new ExponentialBackOff(erp.getBackoff().getInitial().toMillis(), 2.0);
        this.retryBackOff.setMaxInterval(erp.getBackoff().getMax().toMillis());
    }

    @Override
    public ErpPostingOutcome post(ErpInvoicePayload payload, String idempotencyKey) {
        HttpEntity<ErpInvoicePayload> request = new HttpEntity<>(payload, headers(idempotencyKey));
        BackOffExecution backOff = retryBackOff.start();
        int maxAttempts = erp.getMaxRetries() + 1;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ResponseEntity<String> response = restTemplate.postForEntity(INVOICES_PATH, request, String.class);
                if (!response.getStatusCode().is2xxSuccessful()) {
                    lastError = "ERP returned " + response.getStatusCode().value() + " without accepting the invoice";
                    log.warn("ERP did not accept invoice {}: {}", idempotencyKey, lastError);
                    return ErpPostingOutcome.failed(lastError, attempt);
                }
                String reference = reference(response.getBody());
                log.info("ERP accepted invoice {} (reference {}, attempt {})", idempotencyKey, reference, attempt);
                return ErpPostingOutcome.posted(reference, attempt);
            } catch (RestClientResponseException e) {
                lastError = "ERP returned " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString();
                if (!isRetryable(e.getStatusCode())) {
                    log.warn("ERP rejected invoice {}: {}", idempotencyKey, lastError);
                    return ErpPostingOutcome.failed(lastError, attempt);
                }
            } catch (RestClientException e) {
                lastError = "ERP call failed: " + e.getMessage();
            }

            if (attempt < maxAttempts) {
                long delay = backOff.nextBackOff();
                log.warn("Transient ERP failure for {} (attempt {}/{}), retrying in {}ms: {}",
                        idempotencyKey, attempt, maxAttempts, delay, lastError);
                sleep(delay);
            }
        }

        log.error("ERP still failing for {} after {} attempts: {}", idempotencyKey, maxAttempts, lastError);
        return ErpPostingOutcome.failed("ERP unavailable after " + maxAttempts + " attempts: " + lastError,
                maxAttempts);
    }

    private HttpHeaders headers(String idempotencyKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (erp.getToken() != null && !erp.getToken().isBlank()) {
            headers.setBearerAuth(erp.getToken());
        }
        headers.set(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        return headers;
    }

    /**
     * {@code reference}, else {@code id}, from the response body; null when neither is present.
     */
    String reference(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            for (String field : new String[] {"reference", "id"}) {
                JsonNode value = node.get(field);
                if (value != null && !value.isNull() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("ERP response is not JSON, no reference recorded: {}", e.getOriginalMessage());
        }
        return null;
    }

    private static boolean isRetryable(HttpStatusCode status) {
        return status.value() == 429 || status.is5xxServerError();
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ErpInterruptedException(e);
        }
    }
}
