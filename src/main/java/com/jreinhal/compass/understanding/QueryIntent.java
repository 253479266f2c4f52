package com.jreinhal.compass.understanding;

import com.jreinhal.compass.calculation.CalculationType;
import com.jreinhal.compass.schema.TemplateType;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured reading of one user query. Transient: produced per query and never stored.
 */
public record QueryIntent(
        IntentType intent,
        TemplateType template,
        List<String> fields,
        CalculationSpec calculation,
        Filters filters,
        SemanticSearch semanticSearch,
        double confidence,
        Map<String, Object> extractedEntities,
        String originalQuery) {

    public static final double FALLBACK_CONFIDENCE = 0.3;
    public static final int FALLBACK_TOP_K = 5;

    public QueryIntent {
        fields = fields == null ? List.of() : List.copyOf(fields);
        filters = filters == null ? Filters.NONE : filters;
        semanticSearch = semanticSearch == null ? new SemanticSearch(true, originalQuery, FALLBACK_TOP_K) : semanticSearch;
        extractedEntities = extractedEntities == null ? Map.of() : Map.copyOf(extractedEntities);
    }

    /**
     * Intent used when the query cannot be understood: general semantic search over the
     * original text.
     */
    public static QueryIntent fallback(String originalQuery) {
        return new QueryIntent(IntentType.GENERAL_QA, TemplateType.GENERAL, List.of(), null, Filters.NONE,
                new SemanticSearch(true, originalQuery, FALLBACK_TOP_K), FALLBACK_CONFIDENCE, Map.of(), originalQuery);
    }

    public Optional<CalculationSpec> optionalCalculation() {
        return Optional.ofNullable(calculation);
    }

    public QueryIntent withConfidence(double value) {
        return new QueryIntent(intent, template, fields, calculation, filters, semanticSearch, value, extractedEntities, originalQuery);
    }

    public record Filters(String period, String year, String metadataType, String chunkType, String customFilter) {
        public static final Filters NONE = new Filters(null, null, null, null, null);

        public boolean hasPeriod() {
            return period != null && !period.isBlank();
        }

        public boolean hasYear() {
            return year != null && !year.isBlank();
        }
    }

    public record SemanticSearch(boolean enabled, String query, int topK) {
    }

    public record CalculationSpec(CalculationType type, Map<String, Object> params) {
        public CalculationSpec {
            params = params == null ? Map.of() : Map.copyOf(params);
        }

        public Optional<String> stringParam(String key) {
            Object value = params.get(key);
            return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
        }
    }
}
