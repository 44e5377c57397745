package com.invoiceflow.extractor.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceflow.common.model.ErrorText;
import com.invoiceflow.extractor.config.ExtractorProperties;

@DisplayName("OpenAiFieldExtractor Tests")
class OpenAiFieldExtractorTest {

    private static final String URL = "http://llm.test/v1/chat/completions";

    private MockRestServiceServer server;
    private OpenAiFieldExtractor extractor;
    private ExtractorProperties properties;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setUriTemplateHandler(new DefaultUriBuilderFactory("http://llm.test/v1"));
        server = MockRestServiceServer.bindTo(restTemplate).build();

        properties = new ExtractorProperties();
        properties.getLlm().setApiKey("test-key");
        properties.getLlm().setMaxPromptChars(50);

        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        extractor = new OpenAiFieldExtractor(restTemplate, objectMapper, new InvoiceFieldsSanitizer(), properties);
    }

    private static String completion(String content) {
        return "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":" + quote(content) + "}}]}";
    }

    private static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Nested
    @DisplayName("Successful completions")
    class SuccessTests {

        @Test
        @DisplayName("Should send a JSON-mode request and sanitise the answer")
        void shouldExtractFields() {
            server.expect(requestTo(URL))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("Authorization", "Bearer test-key"))
                    .andExpect(jsonPath("$.response_format.type").value("json_object"))
                    .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                    .andRespond(withSuccess(completion(
                            "{\"vendor_name\":\"Acme\",\"total_amount\":1020.00,\"po_number\":\"PO-1\"}"),
                            MediaType.APPLICATION_JSON));

            FieldExtractionResult result = extractor.extract("Acme invoice total 1020", "inv-1");

            server.verify();
            assertThat(result.isDegraded()).isFalse();
            assertThat(result.isTruncated()).isFalse();
            assertThat(result.getFields().getVendorName()).isEqualTo("Acme");
            assertThat(result.getFields().getTotalAmount()).isEqualByComparingTo("1020.00");
            assertThat(result.getFields().getPoNumbers()).containsExactly("PO-1");
        }

        @Test
        @DisplayName("Should truncate long text deterministically and flag it")
        void shouldTruncateLongText() {
            String longText = "A".repeat(49) + "B" + "C".repeat(200);
            server.expect(requestTo(URL))
                    .andExpect(content().string(containsString("A".repeat(49) + "B...[truncated]")))
                    .andExpect(content().string(not(containsString("BC"))))
                    .andRespond(withSuccess(completion("{}"), MediaType.APPLICATION_JSON));

            FieldExtractionResult result = extractor.extract(longText, "inv-1");

            server.verify();
            assertThat(result.isTruncated()).isTrue();
        }

        @Test
        @DisplayName("Should not split an emoji on the truncation boundary")
        void shouldKeepSurrogatePairsWhole() {
            // Given
            String longText = "A".repeat(49) + "\uD83D\uDE00" + "C".repeat(200);
            server.expect(requestTo(URL))
                    .andExpect(content().string(containsString("A".repeat(49) + "...[truncated]")))
                    .andRespond(withSuccess(completion("{}"), MediaType.APPLICATION_JSON));

            // When
            FieldExtractionResult result = extractor.extract(longText, "inv-1");

            // Then
            server.verify();
            assertThat(result.isTruncated()).isTrue();
        }
    }

    @Nested
    @DisplayName("Provider errors")
    class ErrorTests {

        @Test
        @DisplayName("Should surface a 429 as rate limited")
        void shouldRaiseOnRateLimit() {
            server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

            assertThatThrownBy(() -> extractor.extract("text", "inv-1"))
                    .isInstanceOf(LlmRateLimitedException.class);
        }

        @Test
        @DisplayName("Should degrade to empty fields on a server error")
        void shouldDegradeOnServerError() {
            server.expect(requestTo(URL)).andRespond(withServerError());

            FieldExtractionResult result = extractor.extract("text", "inv-1");

            assertThat(result.isDegraded()).isTrue();
            assertThat(result.getFields().getTotalAmount()).isNull();
            assertThat(result.getError()).contains("LLM call failed");
        }

        @Test
        @DisplayName("Should bound a large provider error to the failure_reason column")
        void shouldBoundLargeProviderError() {
            // Given
            server.expect(requestTo(URL))
                    .andRespond(withServerError().contentType(MediaType.TEXT_HTML).body("<html>" + "x".repeat(5000)));

            // When
            FieldExtractionResult result = extractor.extract("text", "inv-1");

            // Then
            assertThat(result.isDegraded()).isTrue();
            assertThat(result.getError()).startsWith("LLM call failed").hasSizeLessThanOrEqualTo(ErrorText.MAX_LENGTH);
        }

        @Test
        @DisplayName("Should degrade when the model answers with something other than JSON")
        void shouldDegradeOnUnparseableContent() {
            server.expect(requestTo(URL))
                    .andRespond(withSuccess(completion("Sorry, I cannot help with that."), MediaType.APPLICATION_JSON));

            FieldExtractionResult result = extractor.extract("text", "inv-1");

            assertThat(result.isDegraded()).isTrue();
            assertThat(result.getError()).contains("unparseable");
        }

        @Test
        @DisplayName("Should not call the provider without an API key")
        void shouldSkipWithoutApiKey() {
            properties.getLlm().setApiKey("");

            FieldExtractionResult result = extractor.extract("text", "inv-1");

            server.verify();
            assertThat(result.isDegraded()).isTrue();
        }
    }
}
