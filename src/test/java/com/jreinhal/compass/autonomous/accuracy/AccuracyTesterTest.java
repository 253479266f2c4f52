package com.jreinhal.compass.autonomous.accuracy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.AccuracyTestCase.ExpectedValue;
import com.jreinhal.compass.model.ComparisonType;
import com.jreinhal.compass.model.DiscrepancyType;
import com.jreinhal.compass.model.TestPriority;
import com.jreinhal.compass.repository.AccuracyTestRepository;
import com.jreinhal.compass.router.RouteType;
import com.jreinhal.compass.understanding.IntentType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AccuracyTesterTest {

    private AccuracyTestRepository testRepository;
    private RagQueryExecutor executor;
    private AccuracyTester tester;

    @BeforeEach
    void setUp() {
        testRepository = mock(AccuracyTestRepository.class);
        executor = mock(RagQueryExecutor.class);
        tester = new AccuracyTester(testRepository, executor);
    }

    private static AccuracyTestCase test(String id, String query, String field, ExpectedValue expected) {
        AccuracyTestCase test = new AccuracyTestCase();
        test.setId(id);
        test.setSchemaId("commission");
        test.setQuery(query);
        test.setCategory("commission");
        test.setPriority(TestPriority.CRITICAL);
        test.setTargetEntity(Map.of("employeeId", "E001", "period", "202510"));
        test.setExpectedFields(List.of(field));
        Map<String, ExpectedValue> values = new LinkedHashMap<>();
        values.put(field, expected);
        test.setExpectedValues(values);
        return test;
    }

    private static AccuracyTestCase commissionTest(String id) {
        return test(id, "내 2025년 10월 수수료 알려줘", "totalcommission",
                new ExpectedValue(1_000_000.0, ComparisonType.NUMERIC_RANGE, null));
    }

    private static RagExecutionResult answer(Map<String, Object> values) {
        return new RagExecutionResult("답변", values, 0.82, 0.7, Map.of("period", "202510"), "commission",
                RouteType.RAG, IntentType.DIRECT_LOOKUP, 0.9);
    }

    @Nested
    @DisplayName("Numeric comparison")
    class Numeric {

        @Test
        void valueWithinTolerancePasses() {
            when(executor.execute(anyString(), eq("commission"), anyMap()))
                    .thenReturn(answer(Map.of("totalCommission", 1_015_000)));

            AccuracyResult result = tester.runTest(commissionTest("t1"));

            assertEquals(TestStatus.PASSED, result.status());
            assertTrue(result.passed());
            assertEquals(1.0, result.accuracy());
            assertEquals(DiscrepancyType.WITHIN_TOLERANCE, result.discrepancies().get(0).type());
            assertEquals(Severity.LOW, result.discrepancies().get(0).severity());
            assertEquals(RouteType.RAG, result.routeType());
            assertEquals(0.82, result.topScore());
        }

        @Test
        void valueOutsideToleranceFails() {
            when(executor.execute(anyString(), anyString(), anyMap()))
                    .thenReturn(answer(Map.of("totalCommission", "1,030,000")));

            AccuracyResult result = tester.runTest(commissionTest("t1"));

            assertEquals(TestStatus.FAILED, result.status());
            assertEquals(0.0, result.accuracy());
            Discrepancy discrepancy = result.discrepancies().get(0);
            assertEquals(DiscrepancyType.WRONG_VALUE, discrepancy.type());
            assertEquals(Severity.HIGH, discrepancy.severity());
            assertTrue(discrepancy.details().endsWith("difference"));
        }

        @Test
        void exactNumberHasNoDiscrepancy() {
            when(executor.execute(anyString(), anyString(), anyMap()))
                    .thenReturn(answer(Map.of("totalcommission", 1_000_000)));

            AccuracyResult result = tester.runTest(commissionTest("t1"));

            assertTrue(result.passed());
            assertTrue(result.discrepancies().isEmpty());
        }

        @Test
        void nonNumericAnswerIsTypeMismatch() {
            when(executor.execute(anyString(), anyString(), anyMap()))
                    .thenReturn(answer(Map.of("totalCommission", "미정")));

            AccuracyResult result = tester.runTest(commissionTest("t1"));

            assertEquals(DiscrepancyType.TYPE_MISMATCH, result.discrepancies().get(0).type());
            assertFalse(result.passed());
        }
    }

    @Test
    void missingFieldIsCritical() {
        when(executor.execute(anyString(), anyString(), anyMap())).thenReturn(answer(Map.of()));

        AccuracyResult result = tester.runTest(commissionTest("t1"));

        Discrepancy discrepancy = result.discrepancies().get(0);
        assertEquals(DiscrepancyType.MISSING, discrepancy.type());
        assertEquals(Severity.CRITICAL, discrepancy.severity());
        assertEquals(TestStatus.FAILED, result.status());
    }

    @Test
    void executorFailureIsAnError() {
        when(executor.execute(anyString(), anyString(), anyMap())).thenThrow(new IllegalStateException("pipeline blocked"));

        AccuracyResult result = tester.runTest(commissionTest("t1"));

        assertEquals(TestStatus.ERROR, result.status());
        assertEquals("pipeline blocked", result.error());
        assertFalse(result.passed());
    }

    @Test
    void otherComparisonTypes() {
        Map<String, Object> extracted = Map.of("remark", "정상 지급 완료", "code", "A-123", "achieved", "달성", "grade", "Gold");

        AccuracyTestCase contains = test("c", "q", "remark", new ExpectedValue("지급", ComparisonType.CONTAINS, null));
        AccuracyTestCase regex = test("r", "q", "code", new ExpectedValue("^[A-Z]-\\d{4}$", ComparisonType.REGEX, null));
        AccuracyTestCase bool = test("b", "q", "achieved", new ExpectedValue(true, ComparisonType.BOOLEAN_CHECK, null));
        AccuracyTestCase exact = test("e", "q", "grade", new ExpectedValue("Silver", ComparisonType.EXACT, null));

        assertTrue(tester.compare(contains, extracted).isEmpty());
        assertEquals(DiscrepancyType.FORMAT_MISMATCH, tester.compare(regex, extracted).get(0).type());
        assertTrue(tester.compare(bool, extracted).isEmpty());
        assertEquals(DiscrepancyType.WRONG_VALUE, tester.compare(exact, extracted).get(0).type());
        assertEquals(Severity.MEDIUM, tester.compare(exact, extracted).get(0).severity());
    }

    @Test
    void allowedDiscrepanciesDecidePass() {
        AccuracyTestCase lenient = commissionTest("t1");
        lenient.setAllowedDiscrepancies(List.of(DiscrepancyType.WITHIN_TOLERANCE, DiscrepancyType.WRONG_VALUE));
        when(executor.execute(anyString(), anyString(), anyMap()))
                .thenReturn(answer(Map.of("totalCommission", 2_000_000)));

        assertTrue(tester.runTest(lenient).passed());
    }

    @Nested
    @DisplayName("Suites")
    class Suites {

        @Test
        void accuracyIsPassedOverRunWithErrorsCounted() {
            AccuracyTestCase passing = commissionTest("pass");
            passing.setQuery("pass");
            AccuracyTestCase failing = commissionTest("fail");
            failing.setQuery("fail");
            AccuracyTestCase erroring = commissionTest("error");
            erroring.setQuery("error");
            erroring.setPriority(TestPriority.LOW);
            when(testRepository.findBySchemaIdAndActiveTrue("commission")).thenReturn(List.of(erroring, passing, failing));
            when(executor.execute(eq("pass"), anyString(), anyMap())).thenReturn(answer(Map.of("totalCommission", 1_000_000)));
            when(executor.execute(eq("fail"), anyString(), anyMap())).thenReturn(answer(Map.of("totalCommission", 5)));
            when(executor.execute(eq("error"), anyString(), anyMap())).thenThrow(new IllegalStateException("boom"));

            TestSuiteResult suite = tester.runTestSuite("commission", null);

            assertEquals(3, suite.testsRun());
            assertEquals(1, suite.testsPassed());
            assertEquals(1, suite.testsFailed());
            assertEquals(1, suite.testsErrored());
            assertEquals(1.0 / 3.0, suite.accuracy(), 1e-9);
            assertEquals("error", suite.results().get(2).testId());
        }

        @Test
        void filtersSelectCategoriesAndPriorities() {
            AccuracyTestCase commission = commissionTest("c");
            AccuracyTestCase mdrt = commissionTest("m");
            mdrt.setCategory("mdrt");
            mdrt.setPriority(TestPriority.MEDIUM);
            when(testRepository.findBySchemaIdAndActiveTrue("commission")).thenReturn(List.of(commission, mdrt));
            when(executor.execute(anyString(), anyString(), anyMap())).thenReturn(answer(Map.of("totalCommission", 1_000_000)));

            TestSuiteResult suite = tester.runTestSuite("commission", new TestRunOptions(Set.of("mdrt"), null));

            assertEquals(1, suite.testsRun());
            assertEquals("m", suite.results().get(0).testId());
        }

        @Test
        void emptySuite() {
            when(testRepository.findBySchemaIdAndActiveTrue("commission")).thenReturn(List.of());

            TestSuiteResult suite = tester.runTestSuite("commission", TestRunOptions.ALL);

            assertEquals(0, suite.testsRun());
            assertEquals(0.0, suite.accuracy());
        }
    }

    @Test
    void booleanWords() {
        assertTrue(AccuracyTester.toBoolean("Yes"));
        assertTrue(AccuracyTester.toBoolean(1));
        assertFalse(AccuracyTester.toBoolean("미달"));
        assertFalse(AccuracyTester.toBoolean(null));
    }
}
