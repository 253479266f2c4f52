package com.jreinhal.compass.understanding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.compass.understanding.PeriodExtractor.PeriodFilter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PeriodExtractorTest {

    private static final Clock NOVEMBER_2025 = Clock.fixed(Instant.parse("2025-11-15T03:00:00Z"), ZoneOffset.UTC);

    @Nested
    @DisplayName("Query extraction")
    class Extraction {

        @Test
        void relativeMonthsResolveAgainstClock() {
            assertEquals(PeriodFilter.ofPeriod("202511"), PeriodExtractor.extract("이번달 수수료", NOVEMBER_2025));
            assertEquals(PeriodFilter.ofPeriod("202511"), PeriodExtractor.extract("이번 달 커미션", NOVEMBER_2025));
            assertEquals(PeriodFilter.ofPeriod("202510"), PeriodExtractor.extract("지난달 수수료", NOVEMBER_2025));
        }

        @Test
        void previousMonthCrossesYearBoundary() {
            Clock january = Clock.fixed(Instant.parse("2026-01-10T00:00:00Z"), ZoneOffset.UTC);

            assertEquals(PeriodFilter.ofPeriod("202512"), PeriodExtractor.extract("전월 실적", january));
        }

        @Test
        void explicitMonthsUseCurrentYear() {
            assertEquals(PeriodFilter.ofPeriod("202511"), PeriodExtractor.extract("11월 수수료", NOVEMBER_2025));
            assertEquals(PeriodFilter.ofPeriod("202503"), PeriodExtractor.extract("3월 커미션", NOVEMBER_2025));
        }

        @Test
        void explicitDatesWin() {
            assertEquals(PeriodFilter.ofPeriod("202503"), PeriodExtractor.extract("2025년 3월 수수료", NOVEMBER_2025));
            assertEquals(PeriodFilter.ofPeriod("202407"), PeriodExtractor.extract("2024-07 실적", NOVEMBER_2025));
            assertEquals(PeriodFilter.ofPeriod("202409"), PeriodExtractor.extract("202409 수수료", NOVEMBER_2025));
        }

        @Test
        void yearTermsProduceYearOnly() {
            PeriodFilter thisYear = PeriodExtractor.extract("올해 총 수입", NOVEMBER_2025);

            assertEquals("2025", thisYear.year());
            assertNull(thisYear.period());
            assertEquals(PeriodFilter.ofYear("2024"), PeriodExtractor.extract("작년 수수료", NOVEMBER_2025));
        }

        @Test
        void noTemporalLanguageYieldsNone() {
            assertTrue(PeriodExtractor.extract("수수료 알려줘", NOVEMBER_2025).isEmpty());
            assertTrue(PeriodExtractor.extract("13월 수수료", NOVEMBER_2025).isEmpty());
            assertEquals(PeriodFilter.NONE, PeriodExtractor.extract(null, NOVEMBER_2025));
        }
    }

    @Test
    void explicitPeriodsKeepOrderOfAppearance() {
        assertEquals(List.of("202510", "202511"), PeriodExtractor.explicitPeriods("10월과 11월 비교", NOVEMBER_2025));
        assertEquals(List.of("202411", "202503"),
                PeriodExtractor.explicitPeriods("2024년 11월이랑 3월 차이", NOVEMBER_2025));
        assertEquals(List.of(), PeriodExtractor.explicitPeriods("지난달 대비", NOVEMBER_2025));
    }

    @Test
    void normalizeHandlesModelOutputForms() {
        assertEquals("202511", PeriodExtractor.normalize("latest", NOVEMBER_2025));
        assertEquals("202510", PeriodExtractor.normalize("지난달", NOVEMBER_2025));
        assertEquals("202509", PeriodExtractor.normalize("2025-09", NOVEMBER_2025));
        assertEquals("202509", PeriodExtractor.normalize("9", NOVEMBER_2025));
        assertEquals("202509", PeriodExtractor.normalize("2025년 9월", NOVEMBER_2025));
        assertEquals("2025", PeriodExtractor.normalize("올해", NOVEMBER_2025));
        assertEquals("2024", PeriodExtractor.normalize("last_year", NOVEMBER_2025));
        assertNull(PeriodExtractor.normalize("  ", NOVEMBER_2025));
    }

    @Test
    void previousAndValidity() {
        assertEquals("202412", PeriodExtractor.previous("202501"));
        assertThrows(IllegalArgumentException.class, () -> PeriodExtractor.previous("2025"));
        assertTrue(PeriodExtractor.isValid("202512"));
        assertFalse(PeriodExtractor.isValid("202513"));
        assertFalse(PeriodExtractor.isValid(null));
    }

    @Test
    void displayFormat() {
        assertEquals("2025년 9월", PeriodExtractor.formatForDisplay("202509"));
        assertEquals("2025년", PeriodExtractor.formatForDisplay("2025"));
        assertEquals("", PeriodExtractor.formatForDisplay(null));
    }
}
