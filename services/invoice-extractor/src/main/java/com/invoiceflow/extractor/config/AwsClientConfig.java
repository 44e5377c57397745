package com.invoiceflow.extractor.config;

import java.net.URI;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS SDK clients. Both are closed with the application context.
 */
@Configuration
public class AwsClientConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(ExtractorProperties properties) {
        ExtractorProperties.Storage storage = properties.getStorage();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(storage.getRegion()))
                .forcePathStyle(storage.isPathStyleAccess())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(storage.getApiCallTimeout())
                        .build());

        if (storage.getEndpoint() != null && !storage.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.getEndpoint()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public TextractClient textractClient(ExtractorProperties properties) {
        return TextractClient.builder()
                .region(Region.of(properties.getStorage().getRegion()))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(properties.getOcr().getApiCallTimeout())
                        .build())
                .build();
    }
}
