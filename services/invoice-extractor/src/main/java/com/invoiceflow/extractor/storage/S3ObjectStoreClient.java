package com.invoiceflow.extractor.storage;

import org.springframework.stereotype.Component;

import com.invoiceflow.extractor.config.ExtractorProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

@Component
@RequiredArgsConstructor
@Slf4j
public class S3ObjectStoreClient implements ObjectStoreClient {

    private final S3Client s3Client;
    private final ExtractorProperties properties;

    @Override
    public byte[] getObject(String key) {
        String bucket = properties.getStorage().getBucket();
        try {
            byte[] content = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build())
                    .asByteArray();
            log.debug("Fetched s3://{}/{} ({} bytes)", bucket, key, content.length);
            return content;
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to fetch s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void putObject(String key, byte[] content, String contentType) {
        String bucket = properties.getStorage().getBucket();
        try {
            s3Client.putObject(PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .build(),
                    RequestBody.fromBytes(content));
            log.debug("Stored s3://{}/{} ({} bytes)", bucket, key, content.length);
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to store s3://" + bucket + "/" + key, e);
        }
    }
}
