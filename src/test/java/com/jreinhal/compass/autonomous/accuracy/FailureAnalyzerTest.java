package com.jreinhal.compass.autonomous.accuracy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.jreinhal.compass.model.DiscrepancyType;
import com.jreinhal.compass.model.OptimizationActionType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FailureAnalyzerTest {

    private final FailureAnalyzer analyzer = new FailureAnalyzer();

    private static AccuracyResult result(String testId, TestStatus status, double topScore, Map<String, Object> filters,
                                         Discrepancy... discrepancies) {
        return new AccuracyResult(testId, "query " + testId, status, status == TestStatus.PASSED, 0.0,
                List.of(discrepancies), "답변", Map.of(), topScore, topScore, filters, "commission", null, null, 0.0,
                null, 10L);
    }

    private static Discrepancy discrepancy(DiscrepancyType type, Severity severity) {
        return new Discrepancy("totalcommission", 1_000_000.0, null, type, severity, "");
    }

    @Test
    void failuresAreGroupedAndRanked() {
        List<AccuracyResult> results = List.of(
                result("t1", TestStatus.FAILED, 0.5, Map.of(), discrepancy(DiscrepancyType.MISSING, Severity.CRITICAL)),
                result("t2", TestStatus.FAILED, 0.6, Map.of("period", "202510"),
                        discrepancy(DiscrepancyType.WRONG_VALUE, Severity.HIGH)),
                result("t3", TestStatus.ERROR, 0.0, Map.of()),
                result("t4", TestStatus.PASSED, 0.9, Map.of("period", "202510")));

        FailureAnalysis analysis = analyzer.analyze(results);

        assertEquals(4, analysis.patterns().size());
        FailurePattern lowRelevance = analysis.patterns().get(0);
        assertEquals(FailurePattern.Kind.LOW_RELEVANCE, lowRelevance.kind());
        assertEquals(List.of("t1", "t2"), lowRelevance.affectedTests());
        assertEquals(0.55, lowRelevance.averageScore(), 1e-9);
        assertEquals("missing_field_totalcommission", analysis.patterns().get(2).key());

        List<OptimizationActionType> ranked = analysis.suggestions().stream()
                .map(OptimizationSuggestion::actionType)
                .toList();
        assertEquals(List.of(OptimizationActionType.FILTER_FIX, OptimizationActionType.EMBEDDING_UPDATE,
                OptimizationActionType.METADATA_ADD, OptimizationActionType.FIELD_ALIAS), ranked);
        assertEquals("Low search relevance scores (avg: 55%)", analysis.suggestions().get(1).reason());
        assertEquals(Map.of("field", "totalcommission"), analysis.suggestions().get(2).change());

        assertEquals(List.of("Critical field \"totalcommission\" missing from 1 test(s)"), analysis.criticalIssues());
    }

    @Test
    void withinToleranceIsNotAPattern() {
        FailureAnalysis analysis = analyzer.analyze(List.of(result("t1", TestStatus.FAILED, 0.9, Map.of("period", "202510"),
                discrepancy(DiscrepancyType.WITHIN_TOLERANCE, Severity.LOW),
                discrepancy(DiscrepancyType.TYPE_MISMATCH, Severity.LOW))));

        assertEquals(1, analysis.patterns().size());
        assertEquals(OptimizationActionType.SCHEMA_UPDATE, analysis.suggestions().get(0).actionType());
        assertEquals("number", analysis.suggestions().get(0).change().get("expectedType"));
    }

    @Test
    void formatMismatchSuggestsQueryPatterns() {
        FailureAnalysis analysis = analyzer.analyze(List.of(result("t1", TestStatus.FAILED, 0.9, Map.of("period", "202510"),
                discrepancy(DiscrepancyType.FORMAT_MISMATCH, Severity.LOW))));

        OptimizationSuggestion suggestion = analysis.suggestions().get(0);
        assertEquals(OptimizationActionType.QUERY_PATTERN, suggestion.actionType());
        assertEquals(List.of("query t1"), suggestion.change().get("patterns"));
    }

    @Test
    void nothingFailedMeansNoAnalysis() {
        assertSame(FailureAnalysis.NONE, analyzer.analyze(List.of(result("t1", TestStatus.PASSED, 0.9, Map.of()))));
    }
}
