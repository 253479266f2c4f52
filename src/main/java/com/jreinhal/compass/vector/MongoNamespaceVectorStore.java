package com.jreinhal.compass.vector;

import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * Namespace vector store persisted in MongoDB. Equality filters are pushed down as query
 * criteria and cosine similarity is computed in process over the candidates.
 */
@Component
public class MongoNamespaceVectorStore implements NamespaceVectorStore {
    private static final Logger log = LoggerFactory.getLogger(MongoNamespaceVectorStore.class);
    static final String COLLECTION_NAME = "namespace_vectors";
    private final MongoTemplate mongoTemplate;

    public MongoNamespaceVectorStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void upsert(String namespace, List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        try {
            for (VectorRecord record : records) {
                List<Double> embedding = toList(record.values());
                MongoVector doc = new MongoVector();
                doc.setId(namespace + ":" + record.id());
                doc.setVectorId(record.id());
                doc.setNamespace(namespace);
                doc.setMetadata(new HashMap<>(record.metadata()));
                doc.setEmbedding(embedding);
                doc.setEmbeddingNorm(computeNorm(embedding));
                this.mongoTemplate.save(doc, COLLECTION_NAME);
            }
            log.info("Upserted {} vectors into namespace {}", records.size(), namespace);
        }
        catch (DataAccessException e) {
            log.error("Failed to upsert vectors into namespace {}", namespace, e);
            throw new VectorStoreException("Failed to save vectors: " + e.getMessage(), e);
        }
    }

    @Override
    public List<VectorMatch> query(String namespace, float[] embedding, QueryOptions options) {
        QueryOptions effective = options != null ? options : QueryOptions.topK(10);
        Query query = new Query(buildCriteria(namespace, effective.filters()));
        List<MongoVector> candidates;
        try {
            candidates = this.mongoTemplate.find(query, MongoVector.class, COLLECTION_NAME);
        }
        catch (DataAccessException e) {
            log.error("Vector query failed for namespace {}", namespace, e);
            throw new VectorStoreException("Vector query failed: " + e.getMessage(), e);
        }
        log.debug("Namespace {} returned {} candidates for filters {}", namespace, candidates.size(), effective.filters().keySet());
        double queryNorm = computeNorm(embedding);
        return candidates.stream()
                .map(doc -> new VectorMatch(doc.getVectorId(),
                        cosineSimilarity(embedding, queryNorm, doc.getEmbedding(), doc.getEmbeddingNorm()),
                        effective.includeMetadata() && doc.getMetadata() != null ? doc.getMetadata() : Map.of()))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed())
                .limit(effective.topK())
                .toList();
    }

    @Override
    public NamespaceStats getNamespaceStats(String namespace) {
        try {
            Query query = new Query(Criteria.where("namespace").is(namespace));
            long count = this.mongoTemplate.count(query, COLLECTION_NAME);
            if (count == 0L) {
                return NamespaceStats.empty(namespace);
            }
            MongoVector sample = this.mongoTemplate.findOne(query, MongoVector.class, COLLECTION_NAME);
            int dimension = sample != null && sample.getEmbedding() != null ? sample.getEmbedding().size() : 0;
            long documents = this.mongoTemplate.findDistinct(query, "metadata.documentId", COLLECTION_NAME, String.class).size();
            return new NamespaceStats(namespace, count, dimension, documents);
        }
        catch (DataAccessException e) {
            log.error("Failed to read stats for namespace {}", namespace, e);
            throw new VectorStoreException("Failed to read namespace stats: " + e.getMessage(), e);
        }
    }

    @Override
    public long deleteByDocumentId(String namespace, String documentId) {
        Query query = new Query(Criteria.where("namespace").is(namespace).and("metadata.documentId").is(documentId));
        try {
            DeleteResult result = this.mongoTemplate.remove(query, COLLECTION_NAME);
            log.info("Deleted {} vectors of one document from namespace {}", result.getDeletedCount(), namespace);
            return result.getDeletedCount();
        }
        catch (DataAccessException e) {
            log.error("Failed to delete vectors from namespace {}", namespace, e);
            throw new VectorStoreException("Failed to delete vectors: " + e.getMessage(), e);
        }
    }

    private Criteria buildCriteria(String namespace, Map<String, Object> filters) {
        Criteria criteria = Criteria.where("namespace").is(namespace);
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            if (filter.getValue() == null) {
                continue;
            }
            Set<Object> variants = new LinkedHashSet<>();
            if (filter.getValue() instanceof Collection<?> values) {
                values.forEach(v -> variants.addAll(normalizeValuesForQuery(v)));
            } else {
                variants.addAll(normalizeValuesForQuery(filter.getValue()));
            }
            criteria = criteria.and("metadata." + filter.getKey()).in(variants);
        }
        return criteria;
    }

    // Metadata may hold "202511" or 202511 for the same period.
    private List<Object> normalizeValuesForQuery(Object value) {
        List<Object> variants = new ArrayList<>();
        String text = String.valueOf(value);
        Double numeric = tryParseDouble(text);
        if (numeric != null) {
            if (numeric == Math.floor(numeric) && !Double.isInfinite(numeric)) {
                variants.add(numeric.longValue());
                variants.add(numeric.intValue());
            }
            variants.add(numeric);
        }
        variants.add(text);
        return variants;
    }

    private static Double tryParseDouble(String value) {
        try {
            return Double.parseDouble(value);
        }
        catch (NumberFormatException e) {
            return null;
        }
    }

    static double cosineSimilarity(float[] v1, double normA, List<Double> v2, Double normB) {
        if (v1 == null || v2 == null || v1.length == 0 || v2.isEmpty() || v1.length != v2.size()) {
            return 0.0;
        }
        double dotProduct = 0.0;
        double docNorm = normB != null ? normB : computeNorm(v2);
        for (int i = 0; i < v1.length; ++i) {
            dotProduct += (double) v1[i] * v2.get(i);
        }
        if (normA == 0.0 || docNorm == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(docNorm));
    }

    private static double computeNorm(float[] embedding) {
        if (embedding == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (float f : embedding) {
            sum += (double) f * (double) f;
        }
        return sum;
    }

    private static double computeNorm(List<Double> embedding) {
        if (embedding == null) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : embedding) {
            if (value != null) {
                sum += value * value;
            }
        }
        return sum;
    }

    private static List<Double> toList(float[] values) {
        if (values == null) {
            return List.of();
        }
        List<Double> list = new ArrayList<>(values.length);
        for (float f : values) {
            list.add((double) f);
        }
        return list;
    }

    public static class MongoVector {
        @Id
        private String id;
        private String vectorId;
        private String namespace;
        private Map<String, Object> metadata;
        private List<Double> embedding;
        private Double embeddingNorm;

        public String getId() {
            return this.id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getVectorId() {
            return this.vectorId;
        }

        public void setVectorId(String vectorId) {
            this.vectorId = vectorId;
        }

        public String getNamespace() {
            return this.namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public Map<String, Object> getMetadata() {
            return this.metadata;
        }

        public void setMetadata(Map<String, Object> metadata) {
            this.metadata = metadata;
        }

        public List<Double> getEmbedding() {
            return this.embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }

        public Double getEmbeddingNorm() {
            return this.embeddingNorm;
        }

        public void setEmbeddingNorm(Double embeddingNorm) {
            this.embeddingNorm = embeddingNorm;
        }
    }
}
