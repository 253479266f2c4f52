package com.jreinhal.compass.router;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of routing one query. {@code response} is set for instant and fallback routes,
 * {@code clarifyQuestion} for clarify routes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouterDecision(
        RouteType route,
        double confidence,
        String category,
        long processingTimeMs,
        String response,
        String clarifyQuestion,
        String matchedPattern) {

    public boolean requiresRag() {
        return route == RouteType.RAG;
    }

    public boolean requiresUserInteraction() {
        return route == RouteType.CLARIFY;
    }
}
