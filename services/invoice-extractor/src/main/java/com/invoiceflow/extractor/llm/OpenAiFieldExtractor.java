package com.invoiceflow.extractor.llm;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.invoiceflow.common.model.InvoiceFields;
import com.invoiceflow.extractor.config.ExtractorProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Field extraction through an OpenAI-compatible chat completions endpoint in JSON mode.
 */
@Component
@Slf4j
public class OpenAiFieldExtractor implements FieldExtractor {

    static final String COMPLETIONS_PATH = "/chat/completions";

    static final String SYSTEM_PROMPT = "You are an invoice data extraction system. "
            + "Return ONLY a single valid JSON object, no additional text. "
            + "Use null for missing values, ISO dates (YYYY-MM-DD) and plain numbers.";

    static final String USER_PROMPT_TEMPLATE = "Extract the following fields from the invoice text below and "
            + "return them as JSON with these keys: vendor_name, invoice_number, invoice_date, due_date, "
            + "total_amount, currency, subtotal, tax_amount, po_number, po_numbers (array), "
            + "line_items (array of objects with description, quantity, unit_price, total_price, sku).\n\n"
            + "INVOICE TEXT:\n%s";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final InvoiceFieldsSanitizer sanitizer;
    private final ExtractorProperties properties;

    public OpenAiFieldExtractor(
            @Qualifier("llmRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            InvoiceFieldsSanitizer sanitizer,
            ExtractorProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.sanitizer = sanitizer;
        this.properties = properties;
    }

    @Override
    public FieldExtractionResult extract(String text, String correlationId) {
        ExtractorProperties.Llm llm = properties.getLlm();
        PromptText prompt = PromptText.bounded(text, llm.getMaxPromptChars());
        if (prompt.isTruncated()) {
            log.warn("Truncating OCR text from {} to {} chars for {}",
                    text.length(), llm.getMaxPromptChars(), correlationId);
        }

        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.error("No language model API key configured, skipping extraction for {}", correlationId);
            return FieldExtractionResult.degraded(prompt.isTruncated(), "LLM API key not configured");
        }

        String responseBody;
        try {
            responseBody = restTemplate.postForObject(
                    COMPLETIONS_PATH, new HttpEntity<>(buildRequest(prompt.getText()), headers(llm)), String.class);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new LlmRateLimitedException("Language model rate limit exceeded for " + correlationId, e);
        } catch (RestClientException e) {
            log.error("Language model call failed for {}: {}", correlationId, e.getMessage(), e);
            return FieldExtractionResult.degraded(prompt.isTruncated(), "LLM call failed: " + e.getMessage());
        }

        try {
            InvoiceFields fields = sanitizer.sanitize(parseContent(responseBody));
            log.info("Extracted fields for {}: vendor={}, invoiceNumber={}, total={}, poNumbers={}",
                    correlationId, fields.getVendorName(), fields.getInvoiceNumber(),
                    fields.getTotalAmount(), fields.getPoNumbers());
            return FieldExtractionResult.builder()
                    .fields(fields)
                    .truncated(prompt.isTruncated())
                    .build();
        } catch (JsonProcessingException | IllegalStateException e) {
            log.warn("Unparseable language model output for {}: {}", correlationId, e.getMessage());
            return FieldExtractionResult.degraded(prompt.isTruncated(), "LLM output unparseable: " + e.getMessage());
        }
    }

    String buildRequest(String invoiceText) {
        ExtractorProperties.Llm llm = properties.getLlm();
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", llm.getModel());
        request.put("temperature", llm.getTemperature());
        request.put("max_tokens", llm.getMaxTokens());
        request.putObject("response_format").put("type", "json_object");

        ArrayNode messages = request.putArray("messages");
        ObjectNode system = messages.addObject();
        system.put("role", "system");
        system.put("content", SYSTEM_PROMPT);
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        user.put("content", String.format(USER_PROMPT_TEMPLATE, invoiceText));

        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion request", e);
        }
    }

    private JsonNode parseContent(String responseBody) throws JsonProcessingException {
        if (responseBody == null || responseBody.isBlank()) {
            throw new IllegalStateException("empty response body");
        }
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new IllegalStateException("no message content in completion");
        }
        return objectMapper.readTree(stripCodeFence(content.asText()));
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, closingFence);
            }
        }
        return trimmed;
    }

    private static HttpHeaders headers(ExtractorProperties.Llm llm) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(llm.getApiKey());
        return headers;
    }
}
