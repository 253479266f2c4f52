package com.jreinhal.compass.repository;

import com.jreinhal.compass.model.GroundTruthRecord;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface GroundTruthRepository extends MongoRepository<GroundTruthRecord, String> {

    List<GroundTruthRecord> findBySchemaIdAndValidTrue(String schemaId);

    List<GroundTruthRecord> findByDocumentIdAndValidTrue(String documentId);

    long countBySchemaIdAndValidTrue(String schemaId);
}
