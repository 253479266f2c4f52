package com.jreinhal.compass.exception;

/**
 * Discovery could not read or sample a namespace. Always scoped to a single namespace.
 */
public class SchemaDiscoveryException extends RuntimeException {
    private final String namespace;

    public SchemaDiscoveryException(String namespace, String message, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
    }

    public String getNamespace() {
        return this.namespace;
    }
}
