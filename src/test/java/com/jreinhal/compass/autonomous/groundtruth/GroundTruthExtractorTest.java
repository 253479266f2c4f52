package com.jreinhal.compass.autonomous.groundtruth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.compass.model.GroundTruthRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class GroundTruthExtractorTest {

    private static final Instant NOW = Instant.parse("2025-11-15T03:00:00Z");

    private final GroundTruthExtractor extractor = new GroundTruthExtractor(Clock.fixed(NOW, ZoneOffset.UTC));

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void extractsOneRecordPerKeyedRow() {
        SourceSheet sheet = new SourceSheet("수수료", List.of(
                row("사번", "E001", "기간", "2025-10", "총 수수료", "1,250,000", "비고", "정상"),
                row("사번", "", "기간", "2025-10", "총 수수료", 10),
                row("사번", 1002.0, "기간", "2025년 11월", "총 수수료", 2_000_000, "비고", " ")));

        List<GroundTruthRecord> records = extractor.extract(sheet,
                ExtractionConfig.of("commission", "doc-1", "사번", "기간"));

        assertEquals(2, records.size());

        GroundTruthRecord first = records.get(0);
        assertEquals("commission", first.getSchemaId());
        assertEquals("doc-1", first.getDocumentId());
        assertEquals(Map.of("employeeId", "E001", "period", "202510"), first.getEntityIdentifier());
        GroundTruthRecord.FieldValue commission = first.getFieldValues().get("총_수수료");
        assertEquals(1_250_000.0, commission.value());
        assertEquals(GroundTruthExtractor.TEXT_CONFIDENCE, commission.confidence());
        assertEquals("수수료!Row2", commission.source());
        assertEquals(NOW, commission.extractedAt());
        assertEquals("정상", first.getFieldValues().get("비고").value());

        GroundTruthRecord second = records.get(1);
        assertEquals("1002", second.employeeId());
        assertEquals("202511", second.period());
        assertEquals("수수료!Row4", second.getFieldValues().get("총_수수료").source());
        assertEquals(1, second.getFieldValues().size());
        assertEquals(GroundTruthExtractor.NUMBER_CONFIDENCE, second.getConfidence());
    }

    @Test
    void selectedFieldsAndConfidenceThreshold() {
        SourceSheet sheet = new SourceSheet(null, List.of(
                row("사번", "E001", "FYC", 3_000_000, "메모", "확인필요"),
                row("사번", "E002", "FYC", 2e12, "메모", "x")));

        List<GroundTruthRecord> records = extractor.extract(sheet,
                ExtractionConfig.of("mdrt", "doc-2", "사번", null).withFields(List.of("FYC")).withMinConfidence(0.9));

        assertEquals(1, records.size());
        assertEquals(Set.of("fyc"), records.get(0).getFieldValues().keySet());
        assertEquals("Sheet1!Row2", records.get(0).getFieldValues().get("fyc").source());
    }

    @Test
    void headerWhitespaceIsTolerated() {
        SourceSheet sheet = new SourceSheet("S", List.of(row(" 사번 ", "E009", "수입", 100)));

        List<GroundTruthRecord> records = extractor.extract(sheet, ExtractionConfig.of("income", "doc-3", "사번", null));

        assertEquals("E009", records.get(0).employeeId());
    }

    @Test
    void valueNormalization() {
        assertEquals(-1000.5, GroundTruthExtractor.normalizeValue("-1,000.5"));
        assertEquals(5.0, GroundTruthExtractor.normalizeValue(5));
        assertEquals(Boolean.TRUE, GroundTruthExtractor.normalizeValue("Yes"));
        assertEquals(Boolean.FALSE, GroundTruthExtractor.normalizeValue("아니오"));
        assertEquals("abc", GroundTruthExtractor.normalizeValue(" abc "));
    }

    @Test
    void periodNormalization() {
        assertEquals("202510", GroundTruthExtractor.normalizePeriod("2025/10"));
        assertEquals("202501", GroundTruthExtractor.normalizePeriod("2025"));
        assertEquals("202503", GroundTruthExtractor.normalizePeriod("2025.3"));
    }

    @Test
    void fieldNamesAreNormalized() {
        assertEquals("total_commission", GroundTruthExtractor.normalizeFieldName("Total Commission"));
        assertEquals("fyc_amount원", GroundTruthExtractor.normalizeFieldName("FYC-Amount(원)"));
    }

    @Test
    void keyColumnIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.of("s", "d", " ", null));
    }

    @Test
    void confidenceReflectsValueKind() {
        assertEquals(0.0, GroundTruthExtractor.fieldConfidence(null));
        assertEquals(0.0, GroundTruthExtractor.fieldConfidence("  "));
        assertTrue(GroundTruthExtractor.fieldConfidence(5e12) < GroundTruthExtractor.NUMBER_CONFIDENCE);
    }
}
