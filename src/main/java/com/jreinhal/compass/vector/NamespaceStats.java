package com.jreinhal.compass.vector;

public record NamespaceStats(String namespace, long vectorCount, int dimension, long documentCount) {

    public static NamespaceStats empty(String namespace) {
        return new NamespaceStats(namespace, 0L, 0, 0L);
    }
}
