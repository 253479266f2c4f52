package com.jreinhal.compass.repository;

import com.jreinhal.compass.model.AccuracyTestCase;
import java.util.Collection;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface AccuracyTestRepository extends MongoRepository<AccuracyTestCase, String> {

    List<AccuracyTestCase> findBySchemaIdAndActiveTrue(String schemaId);

    // Tests whose ground truth was invalidated are deactivated through this lookup.
    List<AccuracyTestCase> findByGroundTruthIdInAndActiveTrue(Collection<String> groundTruthIds);
}
