package com.jreinhal.compass.vector;

/**
 * Raised when the vector store or the embedding backend cannot serve a request.
 */
public class VectorStoreException extends RuntimeException {

    public VectorStoreException(String message) {
        super(message);
    }

    public VectorStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
