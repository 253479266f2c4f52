package com.jreinhal.compass.understanding;

import com.jreinhal.compass.schema.TemplateType;
import java.util.List;

/**
 * Caller-side context of a query: which namespaces it may search and what the
 * conversation already established.
 */
public record QueryContext(
        List<String> namespaces,
        String employeeId,
        String sessionId,
        List<String> previousQueries,
        boolean hasPendingClarification,
        String confirmedPeriod,
        TemplateType confirmedTemplate) {

    public QueryContext {
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
        previousQueries = previousQueries == null ? List.of() : List.copyOf(previousQueries);
    }

    public static QueryContext forNamespaces(List<String> namespaces) {
        return new QueryContext(namespaces, null, null, List.of(), false, null, null);
    }

    public static QueryContext forEmployee(List<String> namespaces, String employeeId) {
        return new QueryContext(namespaces, employeeId, null, List.of(), false, null, null);
    }
}
