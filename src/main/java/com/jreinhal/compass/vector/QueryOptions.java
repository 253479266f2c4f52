package com.jreinhal.compass.vector;

import java.util.Map;

/**
 * Options for a namespace query. Filter values are matched for equality; a collection value
 * matches any of its elements.
 */
public record QueryOptions(int topK, Map<String, Object> filters, boolean includeMetadata) {

    public QueryOptions {
        topK = Math.max(1, topK);
        filters = filters == null ? Map.of() : Map.copyOf(filters);
    }

    public static QueryOptions topK(int topK) {
        return new QueryOptions(topK, Map.of(), true);
    }

    public QueryOptions withFilters(Map<String, Object> filters) {
        return new QueryOptions(topK, filters, includeMetadata);
    }
}
