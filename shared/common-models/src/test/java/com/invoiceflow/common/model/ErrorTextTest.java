package com.invoiceflow.common.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ErrorText Tests")
class ErrorTextTest {

    @Test
    @DisplayName("Short and null text is returned unchanged")
    void shortTextUnchanged() {
        assertThat(ErrorText.bounded(null)).isNull();
        assertThat(ErrorText.bounded("ERP returned 422")).isEqualTo("ERP returned 422");
        assertThat(ErrorText.bounded("x".repeat(ErrorText.MAX_LENGTH))).hasSize(ErrorText.MAX_LENGTH);
    }

    @Test
    @DisplayName("Long text is cut to the column length")
    void longTextIsCut() {
        String body = "<html>" + "x".repeat(3000) + "</html>";

        String bounded = ErrorText.bounded("ERP returned 422: " + body);

        assertThat(bounded).hasSize(ErrorText.MAX_LENGTH).startsWith("ERP returned 422: <html>");
    }

    @Test
    @DisplayName("A surrogate pair on the boundary is dropped whole")
    void surrogatePairIsNotSplit() {
        String text = "abc😀def";

        assertThat(ErrorText.bounded(text, 4)).isEqualTo("abc");
        assertThat(ErrorText.bounded(text, 5)).isEqualTo("abc😀");
    }
}
