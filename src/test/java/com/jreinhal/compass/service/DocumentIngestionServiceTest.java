package com.jreinhal.compass.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.compass.autonomous.groundtruth.SourceSheet;
import com.jreinhal.compass.pipeline.DocumentChangedEvent;
import com.jreinhal.compass.vector.EmbeddingProvider;
import com.jreinhal.compass.vector.NamespaceStats;
import com.jreinhal.compass.vector.NamespaceVectorStore;
import com.jreinhal.compass.vector.VectorRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

class DocumentIngestionServiceTest {

    private NamespaceVectorStore vectorStore;
    private EmbeddingProvider embeddingProvider;
    private ApplicationEventPublisher publisher;
    private DocumentIngestionService service;

    @BeforeEach
    void setUp() {
        vectorStore = mock(NamespaceVectorStore.class);
        embeddingProvider = mock(EmbeddingProvider.class);
        publisher = mock(ApplicationEventPublisher.class);
        service = new DocumentIngestionService(vectorStore, embeddingProvider, publisher);
    }

    @Test
    @SuppressWarnings("unchecked")
    void ingestWritesOneVectorPerRowAndPublishesUpload() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("사번", "1001");
        first.put("period", "202511");
        first.put("totalCommission", 1250000);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("사번", "1002");
        second.put("비고", null);
        when(embeddingProvider.embedBatch(anyList()))
                .thenReturn(List.of(new float[]{0.1f}, new float[]{0.2f}));

        DocumentIngestionService.IngestionResult result = service.ingest("commission", "doc-7",
                new SourceSheet("수수료", List.of(first, Map.of(), second)));

        assertEquals(2, result.vectorsWritten());
        ArgumentCaptor<List<VectorRecord>> records = ArgumentCaptor.forClass(List.class);
        verify(vectorStore).upsert(eq("commission"), records.capture());
        VectorRecord row = records.getValue().get(0);
        assertEquals("doc-7-0", row.id());
        assertEquals("doc-7", row.metadata().get("documentId"));
        assertEquals("수수료!Row2", row.metadata().get("source"));
        assertEquals("row", row.metadata().get("chunkType"));
        VectorRecord third = records.getValue().get(1);
        assertEquals("doc-7-1", third.id());
        assertEquals("수수료!Row4", third.metadata().get("source"));
        assertEquals(false, third.metadata().containsKey("비고"));

        ArgumentCaptor<List<String>> texts = ArgumentCaptor.forClass(List.class);
        verify(embeddingProvider).embedBatch(texts.capture());
        assertEquals("사번: 1001, period: 202511, totalCommission: 1250000", texts.getValue().get(0));
        verify(publisher).publishEvent(DocumentChangedEvent.uploaded("commission", "doc-7"));
    }

    @Test
    void emptySheetWritesNothing() {
        DocumentIngestionService.IngestionResult result = service.ingest("commission", "doc-7",
                new SourceSheet("수수료", List.of()));

        assertEquals(0, result.vectorsWritten());
        verifyNoInteractions(vectorStore, embeddingProvider, publisher);
    }

    @Test
    void ingestRequiresNamespaceAndDocumentId() {
        SourceSheet sheet = new SourceSheet("수수료", List.of(Map.of("사번", "1001")));

        assertThrows(IllegalArgumentException.class, () -> service.ingest(" ", "doc-7", sheet));
        assertThrows(IllegalArgumentException.class, () -> service.ingest("commission", null, sheet));
        verify(vectorStore, never()).upsert(any(), anyList());
    }

    @Test
    void deletePublishesRemainingDocumentCount() {
        when(vectorStore.deleteByDocumentId("commission", "doc-7")).thenReturn(12L);
        when(vectorStore.getNamespaceStats("commission")).thenReturn(new NamespaceStats("commission", 30L, 768, 2L));

        DocumentIngestionService.IngestionResult result = service.delete("commission", "doc-7");

        assertEquals(12, result.vectorsWritten());
        assertEquals(2L, result.remainingDocuments());
        verify(publisher).publishEvent(DocumentChangedEvent.deleted("commission", "doc-7", 2L));
    }
}
