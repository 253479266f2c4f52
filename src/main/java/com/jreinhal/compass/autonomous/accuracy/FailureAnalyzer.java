package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.model.DiscrepancyType;
import com.jreinhal.compass.model.OptimizationActionType;
import com.jreinhal.compass.router.IntentThresholds;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Groups failed test results into patterns and proposes one optimization per pattern,
 * ranked by confidence times expected improvement.
 */
@Component
public class FailureAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(FailureAnalyzer.class);

    public static final List<String> SEMANTIC_ANCHORS = List.of("수수료 조회", "커미션 확인", "실적 확인", "달성 현황", "계약 건수");

    public FailureAnalysis analyze(List<AccuracyResult> results) {
        List<AccuracyResult> failures = results.stream()
                .filter(result -> result.status() == TestStatus.FAILED)
                .toList();
        if (failures.isEmpty()) {
            return FailureAnalysis.NONE;
        }

        Map<String, PatternBuilder> builders = new LinkedHashMap<>();
        Map<String, Set<String>> criticalMissing = new LinkedHashMap<>();
        for (AccuracyResult result : failures) {
            if (result.topScore() < IntentThresholds.HIGH_RELEVANCE) {
                builders.computeIfAbsent("low_relevance", key -> new PatternBuilder(FailurePattern.Kind.LOW_RELEVANCE, null))
                        .add(result);
            }
            if (result.filtersUsed() == null || result.filtersUsed().isEmpty()) {
                builders.computeIfAbsent("filter_mismatch", key -> new PatternBuilder(FailurePattern.Kind.FILTER_MISMATCH, null))
                        .add(result);
            }
            for (Discrepancy discrepancy : result.discrepancies()) {
                FailurePattern.Kind kind = kindOf(discrepancy.type());
                if (kind == null) {
                    continue;
                }
                String key = kind.name() + ":" + discrepancy.field();
                builders.computeIfAbsent(key, k -> new PatternBuilder(kind, discrepancy.field())).add(result);
                if (discrepancy.type() == DiscrepancyType.MISSING && discrepancy.severity() == Severity.CRITICAL) {
                    criticalMissing.computeIfAbsent(discrepancy.field(), k -> new LinkedHashSet<>()).add(result.testId());
                }
            }
        }

        List<FailurePattern> patterns = builders.values().stream().map(PatternBuilder::build).toList();
        List<OptimizationSuggestion> suggestions = patterns.stream()
                .map(this::suggest)
                .sorted(Comparator.comparingDouble(OptimizationSuggestion::score).reversed())
                .toList();
        List<String> criticalIssues = new ArrayList<>();
        criticalMissing.forEach((field, tests) ->
                criticalIssues.add("Critical field \"" + field + "\" missing from " + tests.size() + " test(s)"));

        log.info("Analyzed {} failed tests: {} patterns, {} suggestions, {} critical issues",
                failures.size(), patterns.size(), suggestions.size(), criticalIssues.size());
        return new FailureAnalysis(patterns, suggestions, criticalIssues);
    }

    private OptimizationSuggestion suggest(FailurePattern pattern) {
        String field = pattern.field();
        return switch (pattern.kind()) {
            case LOW_RELEVANCE -> new OptimizationSuggestion(OptimizationActionType.EMBEDDING_UPDATE, "embedding_template",
                    Map.of("semanticAnchors", SEMANTIC_ANCHORS),
                    String.format("Low search relevance scores (avg: %.0f%%)", pattern.averageScore() * 100.0),
                    0.8, 0.15, pattern.affectedTests());
            case FILTER_MISMATCH -> new OptimizationSuggestion(OptimizationActionType.FILTER_FIX, "query_router",
                    Map.of("entityFilters", Map.of("employeeId", true, "period", true)),
                    "Queries ran without entity filters in " + pattern.occurrences() + " test(s)",
                    0.9, 0.2, pattern.affectedTests());
            case MISSING_FIELD -> new OptimizationSuggestion(OptimizationActionType.METADATA_ADD, "schema",
                    Map.of("field", field),
                    "Field \"" + field + "\" missing from " + pattern.occurrences() + " response(s)",
                    0.7, 0.1, pattern.affectedTests());
            case VALUE_MISMATCH -> new OptimizationSuggestion(OptimizationActionType.FIELD_ALIAS, "schema",
                    Map.of("field", field),
                    "Wrong value for \"" + field + "\" in " + pattern.occurrences() + " test(s)",
                    0.6, 0.05, pattern.affectedTests());
            case TYPE_MISMATCH -> new OptimizationSuggestion(OptimizationActionType.SCHEMA_UPDATE, "schema",
                    Map.of("field", field, "expectedType", "number"),
                    "Non-numeric value for numeric field \"" + field + "\"",
                    0.5, 0.05, pattern.affectedTests());
            case PARSING_ERROR -> new OptimizationSuggestion(OptimizationActionType.QUERY_PATTERN, "query_understanding",
                    Map.of("field", field, "patterns", pattern.queries()),
                    "Unexpected format for \"" + field + "\"",
                    0.4, 0.05, pattern.affectedTests());
        };
    }

    private static FailurePattern.Kind kindOf(DiscrepancyType type) {
        return switch (type) {
            case MISSING -> FailurePattern.Kind.MISSING_FIELD;
            case WRONG_VALUE -> FailurePattern.Kind.VALUE_MISMATCH;
            case TYPE_MISMATCH -> FailurePattern.Kind.TYPE_MISMATCH;
            case FORMAT_MISMATCH -> FailurePattern.Kind.PARSING_ERROR;
            case WITHIN_TOLERANCE -> null;
        };
    }

    private static final class PatternBuilder {
        private final FailurePattern.Kind kind;
        private final String field;
        private final Set<String> tests = new LinkedHashSet<>();
        private final Set<String> queries = new LinkedHashSet<>();
        private double scoreSum;

        private PatternBuilder(FailurePattern.Kind kind, String field) {
            this.kind = kind;
            this.field = field;
        }

        void add(AccuracyResult result) {
            if (this.tests.add(result.testId())) {
                this.scoreSum += result.topScore();
                if (result.query() != null) {
                    this.queries.add(result.query());
                }
            }
        }

        FailurePattern build() {
            Double average = this.kind == FailurePattern.Kind.LOW_RELEVANCE ? this.scoreSum / this.tests.size() : null;
            return new FailurePattern(this.kind, this.field, this.tests.size(), List.copyOf(this.tests), average,
                    List.copyOf(this.queries));
        }
    }
}
