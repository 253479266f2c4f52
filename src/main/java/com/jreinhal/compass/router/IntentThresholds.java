package com.jreinhal.compass.router;

/**
 * Confidence bands used to map an understood intent onto a route, plus the relevance
 * bands applied to retrieval scores.
 */
public final class IntentThresholds {
    public static final double INSTANT = 0.95;
    public static final double RAG_HIGH_CONFIDENCE = 0.7;
    public static final double CLARIFICATION = 0.5;
    public static final double FALLBACK = 0.3;

    public static final double MINIMUM_RELEVANCE = 0.35;
    public static final double HIGH_RELEVANCE = 0.7;
    public static final double LOW_RELEVANCE_WARNING = 0.45;

    private IntentThresholds() {}

    public static RouteType routeForConfidence(double confidence) {
        if (confidence >= INSTANT) {
            return RouteType.INSTANT;
        }
        if (confidence >= RAG_HIGH_CONFIDENCE) {
            return RouteType.RAG;
        }
        if (confidence >= CLARIFICATION) {
            return RouteType.CLARIFY;
        }
        return RouteType.FALLBACK;
    }

    public static boolean shouldRequestClarification(double confidence) {
        return confidence >= FALLBACK && confidence < RAG_HIGH_CONFIDENCE;
    }

    public static boolean areResultsRelevant(double avgScore) {
        return avgScore >= MINIMUM_RELEVANCE;
    }
}
