package com.jreinhal.compass.vector;

import java.util.List;

/**
 * Namespace-partitioned vector index. Every namespace holds the vectors of one data domain
 * (for example a commission ledger or an MDRT report).
 */
public interface NamespaceVectorStore {

    void upsert(String namespace, List<VectorRecord> records);

    List<VectorMatch> query(String namespace, float[] embedding, QueryOptions options);

    NamespaceStats getNamespaceStats(String namespace);

    /**
     * Removes every vector whose {@code documentId} metadata matches.
     *
     * @return the number of vectors removed
     */
    long deleteByDocumentId(String namespace, String documentId);
}
