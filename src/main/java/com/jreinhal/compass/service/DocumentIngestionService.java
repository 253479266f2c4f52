package com.jreinhal.compass.service;

import com.jreinhal.compass.autonomous.groundtruth.SourceSheet;
import com.jreinhal.compass.pipeline.DocumentChangedEvent;
import com.jreinhal.compass.vector.EmbeddingProvider;
import com.jreinhal.compass.vector.NamespaceVectorStore;
import com.jreinhal.compass.vector.VectorRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Loads spreadsheet rows into a namespace, one vector per row, and removes them again.
 * Both directions publish a {@link DocumentChangedEvent} so schema caches and ground truth
 * follow the data.
 */
@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);

    public static final String DOCUMENT_ID_KEY = "documentId";
    public static final String SOURCE_KEY = "source";
    public static final String CHUNK_TYPE_KEY = "chunkType";

    private final NamespaceVectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final ApplicationEventPublisher eventPublisher;

    public record IngestionResult(String namespace, String documentId, int vectorsWritten, long remainingDocuments) {
    }

    public DocumentIngestionService(NamespaceVectorStore vectorStore, EmbeddingProvider embeddingProvider,
                                    ApplicationEventPublisher eventPublisher) {
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.eventPublisher = eventPublisher;
    }

    public IngestionResult ingest(String namespace, String documentId, SourceSheet sheet) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
        List<String> texts = new ArrayList<>();
        List<Map<String, Object>> metadata = new ArrayList<>();
        for (int i = 0; i < sheet.rows().size(); i++) {
            Map<String, Object> row = sheet.rows().get(i);
            if (row == null || row.isEmpty()) {
                continue;
            }
            Map<String, Object> meta = new LinkedHashMap<>();
            row.forEach((key, value) -> {
                if (value != null) {
                    meta.put(key, value);
                }
            });
            meta.put(DOCUMENT_ID_KEY, documentId);
            meta.put(SOURCE_KEY, sheet.name() + "!Row" + (i + 2));
            meta.putIfAbsent(CHUNK_TYPE_KEY, "row");
            metadata.add(meta);
            texts.add(rowText(row));
        }
        if (texts.isEmpty()) {
            log.warn("Document {} in namespace {} has no rows to ingest", documentId, namespace);
            return new IngestionResult(namespace, documentId, 0, -1L);
        }

        List<float[]> embeddings = this.embeddingProvider.embedBatch(texts);
        List<VectorRecord> records = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            records.add(new VectorRecord(documentId + "-" + i, embeddings.get(i), metadata.get(i)));
        }
        this.vectorStore.upsert(namespace, records);
        log.info("Ingested {} row vectors for document {} into namespace {}", records.size(), documentId, namespace);
        this.eventPublisher.publishEvent(DocumentChangedEvent.uploaded(namespace, documentId));
        return new IngestionResult(namespace, documentId, records.size(), -1L);
    }

    public IngestionResult delete(String namespace, String documentId) {
        long removed = this.vectorStore.deleteByDocumentId(namespace, documentId);
        long remaining = this.vectorStore.getNamespaceStats(namespace).documentCount();
        log.info("Removed {} vectors of document {} from namespace {} ({} documents remain)",
                removed, documentId, namespace, remaining);
        this.eventPublisher.publishEvent(DocumentChangedEvent.deleted(namespace, documentId, remaining));
        return new IngestionResult(namespace, documentId, (int) removed, remaining);
    }

    static String rowText(Map<String, Object> row) {
        return row.entrySet().stream()
                .filter(entry -> entry.getValue() != null)
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(", "));
    }
}
