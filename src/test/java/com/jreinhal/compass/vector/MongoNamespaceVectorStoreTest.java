package com.jreinhal.compass.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.client.result.DeleteResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

class MongoNamespaceVectorStoreTest {

    @Test
    void upsertPrefixesIdsWithNamespaceAndStoresNorm() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);

        store.upsert("commission", List.of(
                new VectorRecord("doc-1-0", new float[]{3.0f, 4.0f}, Map.of("period", "202511")),
                new VectorRecord("doc-1-1", new float[]{1.0f, 0.0f}, Map.of("period", "202510"))));

        ArgumentCaptor<MongoNamespaceVectorStore.MongoVector> captor =
                ArgumentCaptor.forClass(MongoNamespaceVectorStore.MongoVector.class);
        verify(mongoTemplate, times(2)).save(captor.capture(), eq("namespace_vectors"));
        MongoNamespaceVectorStore.MongoVector first = captor.getAllValues().get(0);
        assertEquals("commission:doc-1-0", first.getId());
        assertEquals("doc-1-0", first.getVectorId());
        assertEquals("commission", first.getNamespace());
        assertEquals(List.of(3.0, 4.0), first.getEmbedding());
        assertEquals(25.0, first.getEmbeddingNorm(), 1e-9);
    }

    @Test
    void upsertIgnoresEmptyBatches() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);

        store.upsert("commission", List.of());

        verify(mongoTemplate, never()).save(any(), anyString());
    }

    @Test
    void upsertWrapsDataAccessFailures() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        when(mongoTemplate.save(any(MongoNamespaceVectorStore.MongoVector.class), eq("namespace_vectors")))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);

        VectorStoreException ex = assertThrows(VectorStoreException.class, () -> store.upsert("commission",
                List.of(new VectorRecord("v1", new float[]{1.0f}, Map.of()))));
        assertTrue(ex.getMessage().contains("Failed to save vectors"));
    }

    @Test
    void queryRanksByCosineSimilarityAndPushesFiltersDown() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);

        MongoNamespaceVectorStore.MongoVector close = vector("close", List.of(1.0, 0.0), Map.of("period", "202511"));
        MongoNamespaceVectorStore.MongoVector far = vector("far", List.of(0.0, 1.0), Map.of("period", 202511));
        MongoNamespaceVectorStore.MongoVector mid = vector("mid", List.of(1.0, 1.0), Map.of("period", "202511"));
        when(mongoTemplate.find(any(Query.class), eq(MongoNamespaceVectorStore.MongoVector.class), eq("namespace_vectors")))
                .thenReturn(List.of(far, close, mid));

        List<VectorMatch> matches = store.query("commission", new float[]{1.0f, 0.0f},
                new QueryOptions(2, Map.of("period", "202511"), true));

        assertEquals(2, matches.size());
        assertEquals("close", matches.get(0).id());
        assertEquals(1.0, matches.get(0).score(), 1e-9);
        assertEquals("mid", matches.get(1).id());
        assertEquals(Math.sqrt(0.5), matches.get(1).score(), 1e-9);
        assertEquals("202511", matches.get(0).value("period").asText());

        ArgumentCaptor<Query> queryCaptor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(queryCaptor.capture(), eq(MongoNamespaceVectorStore.MongoVector.class), eq("namespace_vectors"));
        org.bson.Document criteria = queryCaptor.getValue().getQueryObject();
        assertEquals("commission", criteria.get("namespace"));
        assertTrue(criteria.containsKey("metadata.period"));
    }

    @Test
    void queryOmitsMetadataWhenNotRequested() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);
        when(mongoTemplate.find(any(Query.class), eq(MongoNamespaceVectorStore.MongoVector.class), eq("namespace_vectors")))
                .thenReturn(List.of(vector("v1", List.of(1.0), Map.of("period", "202511"))));

        List<VectorMatch> matches = store.query("commission", new float[]{1.0f}, new QueryOptions(5, Map.of(), false));

        assertEquals(Map.of(), matches.get(0).metadata());
    }

    @Test
    void cosineSimilarityIsZeroForMismatchedDimensions() {
        assertEquals(0.0, MongoNamespaceVectorStore.cosineSimilarity(new float[]{1.0f, 0.0f}, 1.0, List.of(1.0), 1.0));
        assertEquals(0.0, MongoNamespaceVectorStore.cosineSimilarity(new float[]{0.0f}, 0.0, List.of(1.0), 1.0));
    }

    @Test
    void statsReportCountDimensionAndDistinctDocuments() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);
        when(mongoTemplate.count(any(Query.class), eq("namespace_vectors"))).thenReturn(120L);
        when(mongoTemplate.findOne(any(Query.class), eq(MongoNamespaceVectorStore.MongoVector.class), eq("namespace_vectors")))
                .thenReturn(vector("v1", List.of(0.1, 0.2, 0.3), Map.of()));
        when(mongoTemplate.findDistinct(any(Query.class), eq("metadata.documentId"), eq("namespace_vectors"), eq(String.class)))
                .thenReturn(List.of("doc-1", "doc-2"));

        NamespaceStats stats = store.getNamespaceStats("commission");

        assertEquals(new NamespaceStats("commission", 120L, 3, 2L), stats);
    }

    @Test
    void statsForEmptyNamespace() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);
        when(mongoTemplate.count(any(Query.class), eq("namespace_vectors"))).thenReturn(0L);

        assertEquals(NamespaceStats.empty("mdrt"), store.getNamespaceStats("mdrt"));
    }

    @Test
    void deleteByDocumentIdReturnsDeletedCount() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        MongoNamespaceVectorStore store = new MongoNamespaceVectorStore(mongoTemplate);
        DeleteResult result = mock(DeleteResult.class);
        when(result.getDeletedCount()).thenReturn(4L);
        when(mongoTemplate.remove(any(Query.class), eq("namespace_vectors"))).thenReturn(result);

        assertEquals(4L, store.deleteByDocumentId("commission", "doc-1"));

        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).remove(captor.capture(), eq("namespace_vectors"));
        assertEquals("doc-1", captor.getValue().getQueryObject().get("metadata.documentId"));
    }

    private static MongoNamespaceVectorStore.MongoVector vector(String id, List<Double> embedding, Map<String, Object> metadata) {
        MongoNamespaceVectorStore.MongoVector doc = new MongoNamespaceVectorStore.MongoVector();
        doc.setId("commission:" + id);
        doc.setVectorId(id);
        doc.setNamespace("commission");
        doc.setEmbedding(embedding);
        doc.setMetadata(metadata);
        return doc;
    }
}
