package com.jreinhal.compass.autonomous.groundtruth;

import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.AccuracyTestCase.ExpectedValue;
import com.jreinhal.compass.model.ComparisonType;
import com.jreinhal.compass.model.DiscrepancyType;
import com.jreinhal.compass.model.GroundTruthRecord;
import com.jreinhal.compass.model.TestPriority;
import com.jreinhal.compass.understanding.PeriodExtractor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns ground-truth records into natural-language accuracy tests. Fields are bucketed into
 * categories by name, and each category has a small set of Korean query templates.
 */
@Component
public class TestQueryGenerator {

    static final String GENERAL = "general";

    private static final List<CategoryRule> CATEGORY_RULES = List.of(
            new CategoryRule("commission", Pattern.compile("수수료|커미션|commission")),
            new CategoryRule("fyc", Pattern.compile("fyc|mfyc")),
            new CategoryRule("contract", Pattern.compile("계약|건수|contract")),
            new CategoryRule("mdrt", Pattern.compile("mdrt")),
            new CategoryRule("income", Pattern.compile("수입|급여|income|agi")),
            new CategoryRule("achievement", Pattern.compile("달성|실적|achievement")));

    private static final Map<String, List<String>> QUERY_TEMPLATES = Map.of(
            "commission", List.of("내 {period} 수수료 알려줘", "{period} 커미션 얼마야?", "총 수수료가 얼마지?"),
            "fyc", List.of("내 FYC 알려줘", "{period} FYC가 얼마야?", "FYC 실적 조회"),
            "contract", List.of("내 계약 건수 알려줘", "{period} 체결 건수가 몇 건이야?", "신계약 몇 건?"),
            "mdrt", List.of("MDRT 달성했어?", "내 MDRT 현황 알려줘", "MDRT까지 얼마나 남았어?"),
            "income", List.of("내 수입 알려줘", "{period} 급여 얼마야?", "AGI 확인해줘"),
            GENERAL, List.of("내 {field} 알려줘", "{field}가 뭐야?", "{field} 조회"));

    private record CategoryRule(String category, Pattern pattern) {}

    /**
     * Tests for a batch of records, capped at {@code maxTestsPerRecord * records.size()} when
     * the cap is positive.
     */
    public List<AccuracyTestCase> generate(Collection<GroundTruthRecord> records, int maxTestsPerRecord) {
        List<AccuracyTestCase> tests = new ArrayList<>();
        int cap = maxTestsPerRecord > 0 ? maxTestsPerRecord * records.size() : Integer.MAX_VALUE;
        for (GroundTruthRecord record : records) {
            for (AccuracyTestCase test : generate(record)) {
                if (tests.size() >= cap) {
                    return tests;
                }
                tests.add(test);
            }
        }
        return tests;
    }

    public List<AccuracyTestCase> generate(GroundTruthRecord record) {
        List<AccuracyTestCase> tests = new ArrayList<>();
        Map<String, List<String>> categories = categorizeFields(record.getFieldValues().keySet());
        categories.forEach((category, fields) -> tests.addAll(testsForCategory(record, category, fields)));
        return tests;
    }

    /**
     * Buckets field names by the first matching category, preserving field order.
     */
    public static Map<String, List<String>> categorizeFields(Collection<String> fieldNames) {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        for (String field : fieldNames) {
            categories.computeIfAbsent(categoryOf(field), key -> new ArrayList<>()).add(field);
        }
        return categories;
    }

    public static String categoryOf(String field) {
        String lower = field.toLowerCase(Locale.ROOT);
        for (CategoryRule rule : CATEGORY_RULES) {
            if (rule.pattern().matcher(lower).find()) {
                return rule.category();
            }
        }
        return GENERAL;
    }

    public static TestPriority priorityOf(String category) {
        return switch (category) {
            case "commission", "fyc" -> TestPriority.CRITICAL;
            case "contract", "income" -> TestPriority.HIGH;
            case "mdrt", "achievement" -> TestPriority.MEDIUM;
            default -> TestPriority.LOW;
        };
    }

    private List<AccuracyTestCase> testsForCategory(GroundTruthRecord record, String category, List<String> fields) {
        Map<String, ExpectedValue> expectedValues = new LinkedHashMap<>();
        for (String field : fields) {
            GroundTruthRecord.FieldValue fieldValue = record.getFieldValues().get(field);
            if (fieldValue == null || fieldValue.value() == null) {
                continue;
            }
            Object value = fieldValue.value();
            expectedValues.put(field, value instanceof Number
                    ? new ExpectedValue(value, ComparisonType.NUMERIC_RANGE, AccuracyTestCase.DEFAULT_TOLERANCE)
                    : new ExpectedValue(value, ComparisonType.EXACT, null));
        }
        if (expectedValues.isEmpty()) {
            return List.of();
        }

        String period = record.period();
        List<String> queries = new ArrayList<>();
        List<String> patterns = new ArrayList<>();
        for (String template : QUERY_TEMPLATES.getOrDefault(category, QUERY_TEMPLATES.get(GENERAL))) {
            if (template.contains("{period}") && (period == null || period.isBlank())) {
                continue;
            }
            patterns.add(template);
            queries.add(template
                    .replace("{period}", period == null ? "" : PeriodExtractor.formatForDisplay(period))
                    .replace("{field}", fields.get(0)));
        }

        List<AccuracyTestCase> tests = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            AccuracyTestCase test = new AccuracyTestCase();
            test.setSchemaId(record.getSchemaId());
            test.setGroundTruthId(record.getId());
            test.setCategory(category);
            test.setPriority(priorityOf(category));
            test.setName(category + " - " + String.join(", ", fields.subList(0, Math.min(2, fields.size()))));
            test.setQuery(queries.get(i));
            test.setQueryPattern(patterns.get(i));
            List<String> variations = new ArrayList<>(queries);
            variations.remove(i);
            test.setQueryVariations(variations);
            test.setTargetEntity(new LinkedHashMap<>(record.getEntityIdentifier()));
            test.setExpectedFields(new ArrayList<>(expectedValues.keySet()));
            test.setExpectedValues(new LinkedHashMap<>(expectedValues));
            test.setValueTolerance(AccuracyTestCase.DEFAULT_TOLERANCE);
            test.setAllowedDiscrepancies(new ArrayList<>(List.of(DiscrepancyType.WITHIN_TOLERANCE)));
            tests.add(test);
        }
        return tests;
    }
}
