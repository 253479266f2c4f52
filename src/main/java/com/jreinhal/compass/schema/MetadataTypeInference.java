package com.jreinhal.compass.schema;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers semantic types, domain categories and confidence scores for raw vector metadata.
 *
 * Native Java types are checked first; everything else is stringified and run through an
 * ordered list of rules. Period-shaped values are recognised before the generic rules so
 * that {@code "202511"} is treated as a month rather than a large number.
 */
public final class MetadataTypeInference {
    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}(-\\d{2})?$");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern BOOLEAN_PATTERN = Pattern.compile("^(true|false|yes|no|예|아니오)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_MONTH_PATTERN = Pattern.compile("^(19|20)\\d{2}(0[1-9]|1[0-2])$");
    private static final Pattern PERIOD_NAME_PATTERN = Pattern.compile("(^period$|period$|^yearmonth$|마감월|기간|^month$)", Pattern.CASE_INSENSITIVE);
    private static final double EXTREME_MAGNITUDE = 1e12;

    private record CategoryRule(Pattern pattern, FieldCategory category) {
    }

    // Order matters: the first matching rule wins.
    private static final List<CategoryRule> CATEGORY_RULES = List.of(
            new CategoryRule(Pattern.compile("(employee_?id|사번|사원번호|agent_?id|설계사\\s*코드)", Pattern.CASE_INSENSITIVE), FieldCategory.EMPLOYEE_ID),
            new CategoryRule(Pattern.compile("(mdrt|^cot|^tot(?!al))", Pattern.CASE_INSENSITIVE), FieldCategory.MDRT),
            new CategoryRule(Pattern.compile("(fyc|초년도)", Pattern.CASE_INSENSITIVE), FieldCategory.FYC),
            new CategoryRule(Pattern.compile("(^agi|agi(amount|total)|소득)", Pattern.CASE_INSENSITIVE), FieldCategory.AGI),
            new CategoryRule(Pattern.compile("(commission|override|incentive|clawback|수수료|커미션|오버라이드|시책|환수)", Pattern.CASE_INSENSITIVE), FieldCategory.COMMISSION),
            new CategoryRule(Pattern.compile("(payment|지급|실수령)", Pattern.CASE_INSENSITIVE), FieldCategory.PAYMENT),
            new CategoryRule(Pattern.compile("(contract|계약|건수)", Pattern.CASE_INSENSITIVE), FieldCategory.CONTRACT),
            new CategoryRule(Pattern.compile("(income|수입|급여)", Pattern.CASE_INSENSITIVE), FieldCategory.INCOME),
            new CategoryRule(Pattern.compile("(title|content|summary|text|제목|내용|요약)", Pattern.CASE_INSENSITIVE), FieldCategory.TEXT));

    private MetadataTypeInference() {}

    public static FieldType inferType(Object raw) {
        if (raw instanceof MetadataValue value) {
            return inferType(value.raw());
        }
        if (raw instanceof Number) {
            return FieldType.NUMBER;
        }
        if (raw instanceof Boolean) {
            return FieldType.BOOLEAN;
        }
        if (raw instanceof Collection<?> || raw instanceof Object[]) {
            return FieldType.ARRAY;
        }
        if (raw == null) {
            return FieldType.STRING;
        }
        String text = String.valueOf(raw).trim();
        if (DATE_PATTERN.matcher(text).matches()) {
            return FieldType.DATE;
        }
        if (NUMBER_PATTERN.matcher(text.replace(",", "")).matches()) {
            return FieldType.NUMBER;
        }
        if (BOOLEAN_PATTERN.matcher(text).matches()) {
            return FieldType.BOOLEAN;
        }
        return FieldType.STRING;
    }

    /**
     * Resolves the observed type set of one field into a single type. Mixed sets fall back
     * to string unless number was seen without any string.
     */
    public static FieldType resolveType(Set<FieldType> observed) {
        if (observed == null || observed.isEmpty()) {
            return FieldType.STRING;
        }
        if (observed.size() == 1) {
            return observed.iterator().next();
        }
        if (observed.contains(FieldType.STRING)) {
            return FieldType.STRING;
        }
        if (observed.contains(FieldType.NUMBER)) {
            return FieldType.NUMBER;
        }
        return FieldType.STRING;
    }

    public static double confidence(Object raw) {
        if (raw instanceof MetadataValue value) {
            return confidence(value.raw());
        }
        if (raw == null) {
            return 0.0;
        }
        if (raw instanceof Number number) {
            double score = 0.95;
            if (Math.abs(number.doubleValue()) > EXTREME_MAGNITUDE) {
                score *= 0.8;
            }
            return score;
        }
        if (raw instanceof CharSequence text && text.toString().isBlank()) {
            return 0.0;
        }
        return 0.8;
    }

    public static boolean isPeriodFieldName(String fieldName) {
        return fieldName != null && PERIOD_NAME_PATTERN.matcher(fieldName.trim()).find();
    }

    public static boolean isYearMonth(Object raw) {
        if (raw instanceof MetadataValue value) {
            return isYearMonth(value.raw());
        }
        if (raw == null || raw instanceof Boolean || raw instanceof Collection<?>) {
            return false;
        }
        String text;
        if (raw instanceof Number number) {
            double d = number.doubleValue();
            if (d != Math.rint(d)) {
                return false;
            }
            text = String.valueOf((long) d);
        } else {
            text = String.valueOf(raw).trim();
        }
        return YEAR_MONTH_PATTERN.matcher(text).matches();
    }

    /**
     * True when the field should be treated as a period before generic inference: either
     * its name says so, or every sampled value is a {@code YYYYMM} string.
     */
    public static boolean isPeriodField(String fieldName, Collection<?> sampledValues) {
        if (isPeriodFieldName(fieldName)) {
            return true;
        }
        if (sampledValues == null || sampledValues.isEmpty()) {
            return false;
        }
        for (Object value : sampledValues) {
            Object raw = value instanceof MetadataValue mv ? mv.raw() : value;
            if (!(raw instanceof CharSequence) || !isYearMonth(raw)) {
                return false;
            }
        }
        return true;
    }

    public static FieldCategory inferCategory(String fieldName, Collection<?> sampledValues) {
        if (isPeriodField(fieldName, sampledValues)) {
            return FieldCategory.PERIOD;
        }
        if (fieldName == null || fieldName.isBlank()) {
            return FieldCategory.GENERAL;
        }
        String name = fieldName.toLowerCase(Locale.ROOT);
        for (CategoryRule rule : CATEGORY_RULES) {
            if (rule.pattern().matcher(name).find()) {
                return rule.category();
            }
        }
        return FieldCategory.GENERAL;
    }
}
