package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.autonomous.groundtruth.GroundTruthExtractor;
import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.AccuracyTestCase.ExpectedValue;
import com.jreinhal.compass.model.DiscrepancyType;
import com.jreinhal.compass.model.TestPriority;
import com.jreinhal.compass.repository.AccuracyTestRepository;
import com.jreinhal.compass.schema.MetadataValue;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs stored accuracy tests through the query pipeline and compares the answers with the
 * expected ground-truth values.
 */
@Service
public class AccuracyTester {
    private static final Logger log = LoggerFactory.getLogger(AccuracyTester.class);

    private static final Pattern CRITICAL_FIELD = Pattern.compile("commission|fyc|income|수수료|커미션", Pattern.CASE_INSENSITIVE);
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "1", "예", "y", "달성");

    private final AccuracyTestRepository testRepository;
    private final RagQueryExecutor executor;

    public AccuracyTester(AccuracyTestRepository testRepository, RagQueryExecutor executor) {
        this.testRepository = testRepository;
        this.executor = executor;
    }

    public TestSuiteResult runTestSuite(String schemaId, TestRunOptions options) {
        long start = System.currentTimeMillis();
        TestRunOptions filter = options == null ? TestRunOptions.ALL : options;
        List<AccuracyTestCase> tests = this.testRepository.findBySchemaIdAndActiveTrue(schemaId).stream()
                .filter(test -> filter.accepts(test.getCategory(), test.getPriority()))
                .sorted(Comparator.comparingInt((AccuracyTestCase test) -> weight(test.getPriority())).reversed())
                .toList();
        if (tests.isEmpty()) {
            log.info("No active accuracy tests for schema {}", schemaId);
            return TestSuiteResult.empty(schemaId);
        }

        List<AccuracyResult> results = new ArrayList<>(tests.size());
        int passed = 0;
        int failed = 0;
        int errored = 0;
        for (AccuracyTestCase test : tests) {
            AccuracyResult result = runTest(test);
            results.add(result);
            switch (result.status()) {
                case PASSED -> passed++;
                case FAILED -> failed++;
                case ERROR -> errored++;
            }
        }
        double accuracy = (double) passed / tests.size();
        long duration = System.currentTimeMillis() - start;
        log.info("Accuracy suite for {}: {}/{} passed ({} failed, {} errors), accuracy {}",
                schemaId, passed, tests.size(), failed, errored, String.format("%.3f", accuracy));
        return new TestSuiteResult(schemaId, accuracy, tests.size(), passed, failed, errored, results, duration);
    }

    public AccuracyResult runTest(AccuracyTestCase test) {
        long start = System.currentTimeMillis();
        RagExecutionResult execution;
        try {
            execution = this.executor.execute(test.getQuery(), test.getSchemaId(), test.getTargetEntity());
        } catch (RuntimeException e) {
            log.warn("Accuracy test {} could not be executed: {}", test.getId(), e.getMessage(), e);
            return AccuracyResult.error(test.getId(), test.getQuery(), test.getSchemaId(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    System.currentTimeMillis() - start);
        }

        List<Discrepancy> discrepancies = compare(test, execution.extractedValues());
        int matched = 0;
        for (String field : test.getExpectedFields()) {
            boolean fieldOk = discrepancies.stream()
                    .filter(d -> d.field().equals(field))
                    .allMatch(d -> test.getAllowedDiscrepancies().contains(d.type()));
            if (fieldOk) {
                matched++;
            }
        }
        boolean passed = discrepancies.stream().allMatch(d -> test.getAllowedDiscrepancies().contains(d.type()));
        double accuracy = test.getExpectedFields().isEmpty() ? 1.0 : (double) matched / test.getExpectedFields().size();
        return new AccuracyResult(test.getId(), test.getQuery(), passed ? TestStatus.PASSED : TestStatus.FAILED, passed,
                accuracy, discrepancies, execution.response(), execution.extractedValues(), execution.topScore(),
                execution.avgScore(), execution.filtersUsed(), execution.namespace(), execution.routeType(),
                execution.intentType(), execution.intentConfidence(), null, System.currentTimeMillis() - start);
    }

    /**
     * Compares every expected field with the extracted values. Fields that match exactly
     * produce no discrepancy.
     */
    public List<Discrepancy> compare(AccuracyTestCase test, Map<String, Object> extracted) {
        List<Discrepancy> discrepancies = new ArrayList<>();
        for (String field : test.getExpectedFields()) {
            ExpectedValue expected = test.getExpectedValues().get(field);
            if (expected == null) {
                continue;
            }
            Optional<Object> actual = lookup(extracted, field);
            if (actual.isEmpty()) {
                discrepancies.add(new Discrepancy(field, expected.value(), null, DiscrepancyType.MISSING,
                        severity(field, DiscrepancyType.MISSING), "Field not found in response"));
                continue;
            }
            compareValue(field, expected, actual.get(), test.toleranceFor(field)).ifPresent(discrepancies::add);
        }
        return discrepancies;
    }

    private Optional<Discrepancy> compareValue(String field, ExpectedValue expected, Object actual, double tolerance) {
        Object want = expected.value();
        return switch (expected.type()) {
            case NUMERIC_RANGE -> compareNumeric(field, want, actual, tolerance);
            case EXACT -> String.valueOf(want).trim().equals(String.valueOf(actual).trim())
                    ? Optional.empty()
                    : Optional.of(discrepancy(field, want, actual, DiscrepancyType.WRONG_VALUE, "Values differ"));
            case CONTAINS -> String.valueOf(actual).toLowerCase(Locale.ROOT).contains(String.valueOf(want).toLowerCase(Locale.ROOT))
                    ? Optional.empty()
                    : Optional.of(discrepancy(field, want, actual, DiscrepancyType.WRONG_VALUE, "Expected text not contained"));
            case REGEX -> matchesRegex(String.valueOf(want), String.valueOf(actual))
                    ? Optional.empty()
                    : Optional.of(discrepancy(field, want, actual, DiscrepancyType.FORMAT_MISMATCH, "Value does not match pattern " + want));
            case BOOLEAN_CHECK -> toBoolean(want) == toBoolean(actual)
                    ? Optional.empty()
                    : Optional.of(discrepancy(field, want, actual, DiscrepancyType.WRONG_VALUE, "Boolean mismatch"));
        };
    }

    private Optional<Discrepancy> compareNumeric(String field, Object want, Object actual, double tolerance) {
        Optional<Double> expectedNumber = MetadataValue.of(want).asDouble();
        Optional<Double> actualNumber = MetadataValue.of(actual).asDouble();
        if (expectedNumber.isEmpty() || actualNumber.isEmpty()) {
            return Optional.of(discrepancy(field, want, actual, DiscrepancyType.TYPE_MISMATCH, "Expected a number"));
        }
        double expectedValue = expectedNumber.get();
        double diff = Math.abs(actualNumber.get() - expectedValue);
        if (diff == 0.0) {
            return Optional.empty();
        }
        double relative = expectedValue == 0.0 ? Double.POSITIVE_INFINITY : diff / Math.abs(expectedValue);
        String details = String.format("%.2f%% difference", relative * 100.0);
        if (relative <= tolerance) {
            return Optional.of(discrepancy(field, want, actual, DiscrepancyType.WITHIN_TOLERANCE, details));
        }
        return Optional.of(discrepancy(field, want, actual, DiscrepancyType.WRONG_VALUE, details));
    }

    static Severity severity(String field, DiscrepancyType type) {
        boolean critical = CRITICAL_FIELD.matcher(field).find();
        return switch (type) {
            case MISSING -> critical ? Severity.CRITICAL : Severity.HIGH;
            case WRONG_VALUE -> critical ? Severity.HIGH : Severity.MEDIUM;
            default -> Severity.LOW;
        };
    }

    static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        return value != null && TRUE_WORDS.contains(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
    }

    private static Discrepancy discrepancy(String field, Object expected, Object actual, DiscrepancyType type, String details) {
        return new Discrepancy(field, expected, actual, type, severity(field, type), details);
    }

    private static boolean matchesRegex(String regex, String value) {
        try {
            return Pattern.compile(regex).matcher(value).find();
        } catch (PatternSyntaxException e) {
            log.warn("Invalid expected pattern {}: {}", regex, e.getDescription());
            return false;
        }
    }

    /**
     * Finds the field by exact key first, then by normalized name so {@code totalCommission}
     * matches an expected {@code totalcommission}.
     */
    private static Optional<Object> lookup(Map<String, Object> extracted, String field) {
        if (extracted == null) {
            return Optional.empty();
        }
        Object direct = extracted.get(field);
        if (direct != null) {
            return Optional.of(direct);
        }
        String normalized = GroundTruthExtractor.normalizeFieldName(field);
        for (Map.Entry<String, Object> entry : extracted.entrySet()) {
            if (entry.getValue() != null && GroundTruthExtractor.normalizeFieldName(entry.getKey()).equals(normalized)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private static int weight(TestPriority priority) {
        return priority == null ? 0 : priority.weight();
    }
}
