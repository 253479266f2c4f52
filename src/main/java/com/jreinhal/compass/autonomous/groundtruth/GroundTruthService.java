package com.jreinhal.compass.autonomous.groundtruth;

import com.jreinhal.compass.model.AccuracyTestCase;
import com.jreinhal.compass.model.GroundTruthRecord;
import com.jreinhal.compass.pipeline.DocumentChangedEvent;
import com.jreinhal.compass.repository.AccuracyTestRepository;
import com.jreinhal.compass.repository.GroundTruthRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Persistence side of ground truth: saves extracted records (replacing the values of an entity
 * already known for the schema), invalidates records when their document changes and keeps
 * the generated accuracy tests in step.
 */
@Service
public class GroundTruthService {
    private static final Logger log = LoggerFactory.getLogger(GroundTruthService.class);

    private final GroundTruthRepository groundTruthRepository;
    private final AccuracyTestRepository testRepository;
    private final GroundTruthExtractor extractor;
    private final TestQueryGenerator testGenerator;
    private final Clock clock;

    @Value("${compass.autonomous.max-tests-per-record:5}")
    private int maxTestsPerRecord = 5;

    public GroundTruthService(GroundTruthRepository groundTruthRepository, AccuracyTestRepository testRepository,
                              GroundTruthExtractor extractor, TestQueryGenerator testGenerator, Clock clock) {
        this.groundTruthRepository = groundTruthRepository;
        this.testRepository = testRepository;
        this.extractor = extractor;
        this.testGenerator = testGenerator;
        this.clock = clock;
    }

    public List<GroundTruthRecord> extractAndSave(SourceSheet sheet, ExtractionConfig config) {
        return save(this.extractor.extract(sheet, config));
    }

    /**
     * Saves records. A valid record with the same schema and entity identifier is updated in
     * place rather than duplicated.
     */
    public List<GroundTruthRecord> save(List<GroundTruthRecord> records) {
        Map<String, Map<Map<String, String>, GroundTruthRecord>> existingBySchema = new HashMap<>();
        List<GroundTruthRecord> toSave = new ArrayList<>(records.size());
        int updated = 0;
        for (GroundTruthRecord record : records) {
            Map<Map<String, String>, GroundTruthRecord> existing = existingBySchema.computeIfAbsent(
                    record.getSchemaId(), this::indexByEntity);
            GroundTruthRecord current = existing.get(record.getEntityIdentifier());
            if (current != null) {
                current.setFieldValues(record.getFieldValues());
                current.setConfidence(record.getConfidence());
                current.setDocumentId(record.getDocumentId());
                toSave.add(current);
                updated++;
            } else {
                toSave.add(record);
            }
        }
        List<GroundTruthRecord> saved = this.groundTruthRepository.saveAll(toSave);
        log.info("Saved {} ground truth records ({} updated in place)", saved.size(), updated);
        return saved;
    }

    public List<GroundTruthRecord> getValidRecords(String schemaId) {
        return this.groundTruthRepository.findBySchemaIdAndValidTrue(schemaId);
    }

    /**
     * Marks every valid record from the document invalid and deactivates the tests generated
     * from them.
     *
     * @return number of records invalidated
     */
    public int invalidateForDocument(String documentId, String reason) {
        List<GroundTruthRecord> records = this.groundTruthRepository.findByDocumentIdAndValidTrue(documentId);
        if (records.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now(this.clock);
        records.forEach(record -> record.invalidate(reason, now));
        this.groundTruthRepository.saveAll(records);

        List<String> ids = records.stream().map(GroundTruthRecord::getId).toList();
        List<AccuracyTestCase> tests = this.testRepository.findByGroundTruthIdInAndActiveTrue(ids);
        tests.forEach(test -> test.setActive(false));
        this.testRepository.saveAll(tests);
        log.info("Invalidated {} ground truth records and {} tests for document {} ({})",
                records.size(), tests.size(), documentId, reason);
        return records.size();
    }

    /**
     * Regenerates the schema's test suite from its valid records. Previously active tests are
     * deactivated first.
     */
    public List<AccuracyTestCase> generateAndSaveTests(String schemaId) {
        List<GroundTruthRecord> records = getValidRecords(schemaId);
        List<AccuracyTestCase> previous = this.testRepository.findBySchemaIdAndActiveTrue(schemaId);
        if (!previous.isEmpty()) {
            previous.forEach(test -> test.setActive(false));
            this.testRepository.saveAll(previous);
        }
        List<AccuracyTestCase> tests = this.testGenerator.generate(records, this.maxTestsPerRecord);
        List<AccuracyTestCase> saved = this.testRepository.saveAll(tests);
        log.info("Generated {} accuracy tests from {} ground truth records for schema {}",
                saved.size(), records.size(), schemaId);
        return saved;
    }

    @EventListener
    public void onDocumentChanged(DocumentChangedEvent event) {
        if (event.documentId() == null || event.documentId().isBlank()) {
            return;
        }
        invalidateForDocument(event.documentId(), "document_" + event.type().name().toLowerCase(Locale.ROOT));
    }

    private Map<Map<String, String>, GroundTruthRecord> indexByEntity(String schemaId) {
        Map<Map<String, String>, GroundTruthRecord> index = new HashMap<>();
        for (GroundTruthRecord record : this.groundTruthRepository.findBySchemaIdAndValidTrue(schemaId)) {
            index.put(record.getEntityIdentifier(), record);
        }
        return index;
    }
}
