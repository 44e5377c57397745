package com.invoiceflow.poster.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ErpClientConfig {

    @Bean
    public RestTemplate erpRestTemplate(RestTemplateBuilder builder, PosterProperties properties) {
        PosterProperties.Erp erp = properties.getErp();
        return builder
                .rootUri(erp.getBaseUrl())
                .setConnectTimeout(erp.getConnectTimeout())
                .setReadTimeout(erp.getReadTimeout())
                .build();
    }
}
