package com.invoiceflow.extractor.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class LlmClientConfig {

    @Bean
    public RestTemplate llmRestTemplate(RestTemplateBuilder builder, ExtractorProperties properties) {
        ExtractorProperties.Llm llm = properties.getLlm();
        return builder
                .rootUri(llm.getBaseUrl())
                .setConnectTimeout(llm.getConnectTimeout())
                .setReadTimeout(llm.getReadTimeout())
                .build();
    }
}
