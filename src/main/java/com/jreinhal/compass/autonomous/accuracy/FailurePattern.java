package com.jreinhal.compass.autonomous.accuracy;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Locale;

/**
 * A recurring cause of failure. {@code field} is set for field-level kinds;
 * {@code averageScore} only for {@link Kind#LOW_RELEVANCE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailurePattern(
        Kind kind,
        String field,
        int occurrences,
        List<String> affectedTests,
        Double averageScore,
        List<String> queries) {

    public enum Kind {
        LOW_RELEVANCE,
        FILTER_MISMATCH,
        MISSING_FIELD,
        VALUE_MISMATCH,
        TYPE_MISMATCH,
        PARSING_ERROR
    }

    public String key() {
        String base = kind.name().toLowerCase(Locale.ROOT);
        return field == null ? base : base + "_" + field;
    }
}
