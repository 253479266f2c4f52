package com.jreinhal.compass.autonomous.groundtruth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.GroundTruthRecord;
import com.jreinhal.compass.model.GroundTruthRecord.FieldValue;
import com.jreinhal.compass.pipeline.DocumentChangedEvent;
import com.jreinhal.compass.repository.AccuracyTestRepository;
import com.jreinhal.compass.repository.GroundTruthRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GroundTruthServiceTest {

    private static final Instant NOW = Instant.parse("2025-11-15T03:00:00Z");

    private GroundTruthRepository groundTruthRepository;
    private AccuracyTestRepository testRepository;
    private GroundTruthService service;

    @BeforeEach
    void setUp() {
        groundTruthRepository = mock(GroundTruthRepository.class);
        testRepository = mock(AccuracyTestRepository.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new GroundTruthService(groundTruthRepository, testRepository, new GroundTruthExtractor(clock),
                new TestQueryGenerator(), clock);

        when(groundTruthRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        when(testRepository.saveAll(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static GroundTruthRecord record(String id, String employeeId, double commission) {
        GroundTruthRecord record = new GroundTruthRecord("commission", "doc-1",
                Map.of("employeeId", employeeId, "period", "202510"),
                Map.of("총_수수료", new FieldValue(commission, 0.95, "수수료!Row2", NOW)), NOW);
        record.setId(id);
        return record;
    }

    @Test
    void knownEntityIsUpdatedInPlace() {
        GroundTruthRecord existing = record("gt-1", "E001", 1_000_000);
        when(groundTruthRepository.findBySchemaIdAndValidTrue("commission")).thenReturn(List.of(existing));

        GroundTruthRecord incoming = record(null, "E001", 1_250_000);
        incoming.setDocumentId("doc-2");
        GroundTruthRecord fresh = record(null, "E002", 900_000);

        List<GroundTruthRecord> saved = service.save(List.of(incoming, fresh));

        assertEquals(2, saved.size());
        assertSame(existing, saved.get(0));
        assertEquals(1_250_000.0, existing.getFieldValues().get("총_수수료").value());
        assertEquals("doc-2", existing.getDocumentId());
        assertSame(fresh, saved.get(1));
    }

    @Test
    void extractAndSaveRunsExtractorFirst() {
        when(groundTruthRepository.findBySchemaIdAndValidTrue("commission")).thenReturn(List.of());
        SourceSheet sheet = new SourceSheet("수수료", List.of(Map.of("사번", "E001", "총 수수료", 1_000)));

        List<GroundTruthRecord> saved = service.extractAndSave(sheet,
                ExtractionConfig.of("commission", "doc-1", "사번", null));

        assertEquals(1, saved.size());
        assertEquals("E001", saved.get(0).employeeId());
    }

    @Test
    void documentChangeInvalidatesRecordsAndTests() {
        GroundTruthRecord record = record("gt-1", "E001", 1_000_000);
        AccuracyTestCase test = new AccuracyTestCase();
        test.setGroundTruthId("gt-1");
        when(groundTruthRepository.findByDocumentIdAndValidTrue("doc-1")).thenReturn(List.of(record));
        when(testRepository.findByGroundTruthIdInAndActiveTrue(List.of("gt-1"))).thenReturn(List.of(test));

        service.onDocumentChanged(DocumentChangedEvent.deleted("commission", "doc-1", 0));

        assertFalse(record.isValid());
        assertEquals("document_delete", record.getInvalidatedReason());
        assertEquals(NOW, record.getInvalidatedAt());
        assertFalse(test.isActive());
    }

    @Test
    void eventsWithoutDocumentIdAreIgnored() {
        service.onDocumentChanged(DocumentChangedEvent.uploaded("commission", null));

        verify(groundTruthRepository, never()).findByDocumentIdAndValidTrue(anyString());
    }

    @Test
    void unknownDocumentInvalidatesNothing() {
        when(groundTruthRepository.findByDocumentIdAndValidTrue("doc-9")).thenReturn(List.of());

        assertEquals(0, service.invalidateForDocument("doc-9", "manual"));
        verify(testRepository, never()).findByGroundTruthIdInAndActiveTrue(anyCollection());
    }

    @Test
    void regeneratingTestsDeactivatesPreviousSuite() {
        AccuracyTestCase old = new AccuracyTestCase();
        when(testRepository.findBySchemaIdAndActiveTrue("commission")).thenReturn(List.of(old));
        when(groundTruthRepository.findBySchemaIdAndValidTrue("commission"))
                .thenReturn(List.of(record("gt-1", "E001", 1_000_000)));

        List<AccuracyTestCase> tests = service.generateAndSaveTests("commission");

        assertFalse(old.isActive());
        assertEquals(3, tests.size());
        assertEquals("gt-1", tests.get(0).getGroundTruthId());
    }
}
