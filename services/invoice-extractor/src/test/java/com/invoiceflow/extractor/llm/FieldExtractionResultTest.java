package com.invoiceflow.extractor.llm;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.invoiceflow.common.model.ErrorText;

@DisplayName("FieldExtractionResult Tests")
class FieldExtractionResultTest {

    @Test
    @DisplayName("Degraded results carry empty fields and an error bounded to the failure_reason column")
    void degradedErrorIsBounded() {
        FieldExtractionResult result = FieldExtractionResult.degraded(true, "LLM call failed: " + "x".repeat(5000));

        assertThat(result.isDegraded()).isTrue();
        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getFields().getTotalAmount()).isNull();
        assertThat(result.getError()).hasSize(ErrorText.MAX_LENGTH).startsWith("LLM call failed: ");
    }
}
