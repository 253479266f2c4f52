package com.jreinhal.compass.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MetadataTypeInferenceTest {

    @Nested
    @DisplayName("Value types")
    class ValueTypes {

        @Test
        void nativeTypesWinOverTextRules() {
            assertEquals(FieldType.NUMBER, MetadataTypeInference.inferType(1_500_000));
            assertEquals(FieldType.NUMBER, MetadataTypeInference.inferType(12.5d));
            assertEquals(FieldType.BOOLEAN, MetadataTypeInference.inferType(Boolean.TRUE));
            assertEquals(FieldType.ARRAY, MetadataTypeInference.inferType(List.of("a", "b")));
        }

        @Test
        void stringsAreClassifiedByShape() {
            assertEquals(FieldType.DATE, MetadataTypeInference.inferType("2025-11"));
            assertEquals(FieldType.DATE, MetadataTypeInference.inferType("2025-11-03"));
            assertEquals(FieldType.NUMBER, MetadataTypeInference.inferType("1,500,000"));
            assertEquals(FieldType.NUMBER, MetadataTypeInference.inferType("-3.25"));
            assertEquals(FieldType.BOOLEAN, MetadataTypeInference.inferType("예"));
            assertEquals(FieldType.BOOLEAN, MetadataTypeInference.inferType("FALSE"));
            assertEquals(FieldType.STRING, MetadataTypeInference.inferType("홍길동"));
            assertEquals(FieldType.STRING, MetadataTypeInference.inferType(null));
        }

        @Test
        @DisplayName("One string among numbers resolves the field to string")
        void mixedNumberAndStringResolvesToString() {
            assertEquals(FieldType.STRING, MetadataTypeInference.resolveType(EnumSet.of(FieldType.NUMBER, FieldType.STRING)));
        }

        @Test
        void numberWithoutStringWinsMixedSets() {
            assertEquals(FieldType.NUMBER, MetadataTypeInference.resolveType(EnumSet.of(FieldType.NUMBER, FieldType.BOOLEAN)));
            assertEquals(FieldType.STRING, MetadataTypeInference.resolveType(EnumSet.of(FieldType.BOOLEAN, FieldType.DATE)));
            assertEquals(FieldType.STRING, MetadataTypeInference.resolveType(Set.of()));
        }
    }

    @Nested
    @DisplayName("Categories")
    class Categories {

        @Test
        void periodDetectedByNameOrValues() {
            assertEquals(FieldCategory.PERIOD, MetadataTypeInference.inferCategory("period", List.of()));
            assertEquals(FieldCategory.PERIOD, MetadataTypeInference.inferCategory("마감월", List.of()));
            assertEquals(FieldCategory.PERIOD, MetadataTypeInference.inferCategory("closing", List.of("202510", "202511")));
        }

        @Test
        void numericYearMonthValuesAloneDoNotMakeAPeriod() {
            assertFalse(MetadataTypeInference.isPeriodField("closing", List.of(202510, 202511)));
            assertTrue(MetadataTypeInference.isYearMonth(202511));
            assertFalse(MetadataTypeInference.isYearMonth("202513"));
        }

        @Test
        void domainCategoriesFollowRuleOrder() {
            assertEquals(FieldCategory.EMPLOYEE_ID, MetadataTypeInference.inferCategory("employeeId", null));
            assertEquals(FieldCategory.MDRT, MetadataTypeInference.inferCategory("mdrtStatus", null));
            assertEquals(FieldCategory.MDRT, MetadataTypeInference.inferCategory("totAchieved", null));
            assertEquals(FieldCategory.COMMISSION, MetadataTypeInference.inferCategory("totalCommission", null));
            assertEquals(FieldCategory.FYC, MetadataTypeInference.inferCategory("fycAmount", null));
            assertEquals(FieldCategory.AGI, MetadataTypeInference.inferCategory("agiAmount", null));
            assertEquals(FieldCategory.PAYMENT, MetadataTypeInference.inferCategory("실수령액", null));
            assertEquals(FieldCategory.CONTRACT, MetadataTypeInference.inferCategory("계약건수", null));
            assertEquals(FieldCategory.TEXT, MetadataTypeInference.inferCategory("summary", null));
            assertEquals(FieldCategory.GENERAL, MetadataTypeInference.inferCategory("branch", null));
        }
    }

    @Test
    void confidenceDependsOnValueKind() {
        assertEquals(0.95, MetadataTypeInference.confidence(1_000), 1e-9);
        assertEquals(0.76, MetadataTypeInference.confidence(5e12), 1e-9);
        assertEquals(0.8, MetadataTypeInference.confidence("홍길동"), 1e-9);
        assertEquals(0.0, MetadataTypeInference.confidence("  "), 1e-9);
        assertEquals(0.0, MetadataTypeInference.confidence(null), 1e-9);
    }
}
