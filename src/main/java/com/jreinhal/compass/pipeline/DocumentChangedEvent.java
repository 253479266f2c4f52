package com.jreinhal.compass.pipeline;

/**
 * Published when a document's vectors were added to or removed from a namespace.
 * {@code remainingDocuments} is only meaningful for deletions.
 */
public record DocumentChangedEvent(ChangeType type, String namespace, String documentId, long remainingDocuments) {

    public enum ChangeType {
        UPLOAD,
        DELETE
    }

    public static DocumentChangedEvent uploaded(String namespace, String documentId) {
        return new DocumentChangedEvent(ChangeType.UPLOAD, namespace, documentId, -1L);
    }

    public static DocumentChangedEvent deleted(String namespace, String documentId, long remainingDocuments) {
        return new DocumentChangedEvent(ChangeType.DELETE, namespace, documentId, remainingDocuments);
    }
}
