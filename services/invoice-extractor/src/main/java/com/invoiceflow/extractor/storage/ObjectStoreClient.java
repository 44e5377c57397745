package com.invoiceflow.extractor.storage;

/**
 * Key-addressed blob storage for source documents and intermediate artifacts.
 */
public interface ObjectStoreClient {

    byte[] getObject(String key);

    void putObject(String key, byte[] content, String contentType);
}
