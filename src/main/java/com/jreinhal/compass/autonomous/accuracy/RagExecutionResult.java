package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.router.RouteType;
import com.jreinhal.compass.understanding.IntentType;
import java.util.Map;

/**
 * What the query pipeline produced for one test query. {@code extractedValues} holds the
 * field values of the best-matching retrieved record.
 */
public record RagExecutionResult(
        String response,
        Map<String, Object> extractedValues,
        double topScore,
        double avgScore,
        Map<String, Object> filtersUsed,
        String namespace,
        RouteType routeType,
        IntentType intentType,
        double intentConfidence) {

    public RagExecutionResult {
        extractedValues = extractedValues == null ? Map.of() : extractedValues;
        filtersUsed = filtersUsed == null ? Map.of() : filtersUsed;
    }
}
