package com.invoiceflow.extractor.storage;

/**
 * Thrown when the object store cannot be reached or rejects a request.
 */
public class ObjectStoreException extends RuntimeException {

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
