package com.jreinhal.compass.autonomous.groundtruth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.ComparisonType;
import com.jreinhal.compass.model.DiscrepancyType;
import com.jreinhal.compass.model.GroundTruthRecord;
import com.jreinhal.compass.model.GroundTruthRecord.FieldValue;
import com.jreinhal.compass.model.TestPriority;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TestQueryGeneratorTest {

    private static final Instant NOW = Instant.parse("2025-11-15T03:00:00Z");

    private final TestQueryGenerator generator = new TestQueryGenerator();

    private static GroundTruthRecord record(Map<String, String> entity) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        values.put("총_수수료", new FieldValue(1_250_000.0, 0.95, "수수료!Row2", NOW));
        values.put("계약_건수", new FieldValue(12.0, 0.95, "수수료!Row2", NOW));
        values.put("비고", new FieldValue("정상", 0.8, "수수료!Row2", NOW));
        GroundTruthRecord record = new GroundTruthRecord("commission", "doc-1", entity, values, NOW);
        record.setId("gt-1");
        return record;
    }

    @Test
    void generatesTestsPerCategory() {
        List<AccuracyTestCase> tests = generator.generate(record(Map.of("employeeId", "E001", "period", "202510")));

        assertEquals(9, tests.size());

        AccuracyTestCase first = tests.get(0);
        assertEquals("commission", first.getCategory());
        assertEquals(TestPriority.CRITICAL, first.getPriority());
        assertEquals("내 2025년 10월 수수료 알려줘", first.getQuery());
        assertEquals("내 {period} 수수료 알려줘", first.getQueryPattern());
        assertEquals(List.of("2025년 10월 커미션 얼마야?", "총 수수료가 얼마지?"), first.getQueryVariations());
        assertEquals("gt-1", first.getGroundTruthId());
        assertEquals("commission", first.getSchemaId());
        assertEquals(List.of("총_수수료"), first.getExpectedFields());
        assertEquals(ComparisonType.NUMERIC_RANGE, first.getExpectedValues().get("총_수수료").type());
        assertEquals(List.of(DiscrepancyType.WITHIN_TOLERANCE), first.getAllowedDiscrepancies());
        assertEquals(Map.of("employeeId", "E001", "period", "202510"), first.getTargetEntity());

        AccuracyTestCase contract = tests.get(3);
        assertEquals("contract", contract.getCategory());
        assertEquals(TestPriority.HIGH, contract.getPriority());

        AccuracyTestCase general = tests.get(6);
        assertEquals(TestQueryGenerator.GENERAL, general.getCategory());
        assertEquals("내 비고 알려줘", general.getQuery());
        AccuracyTestCase.ExpectedValue remark = general.getExpectedValues().get("비고");
        assertEquals(ComparisonType.EXACT, remark.type());
        assertNull(remark.tolerance());
    }

    @Test
    void periodTemplatesAreSkippedWithoutPeriod() {
        List<AccuracyTestCase> tests = generator.generate(record(Map.of("employeeId", "E001")));

        List<String> queries = tests.stream().map(AccuracyTestCase::getQuery).toList();
        assertEquals(List.of("총 수수료가 얼마지?", "내 계약 건수 알려줘", "신계약 몇 건?",
                "내 비고 알려줘", "비고가 뭐야?", "비고 조회"), queries);
        assertFalse(queries.stream().anyMatch(q -> q.contains("{period}")));
    }

    @Test
    void batchIsCappedPerRecord() {
        List<AccuracyTestCase> tests = generator.generate(List.of(record(Map.of("period", "202510"))), 5);

        assertEquals(5, tests.size());
        assertEquals(9, generator.generate(List.of(record(Map.of("period", "202510"))), 0).size());
    }

    @Test
    void categoriesAndPriorities() {
        assertEquals("fyc", TestQueryGenerator.categoryOf("MFYC"));
        assertEquals("income", TestQueryGenerator.categoryOf("agi_total"));
        assertEquals("achievement", TestQueryGenerator.categoryOf("실적률"));
        assertEquals(TestPriority.MEDIUM, TestQueryGenerator.priorityOf("mdrt"));
        assertEquals(TestPriority.LOW, TestQueryGenerator.priorityOf(TestQueryGenerator.GENERAL));
        assertEquals(List.of("수수료", "커미션"),
                TestQueryGenerator.categorizeFields(List.of("수수료", "커미션", "메모")).get("commission"));
    }
}
