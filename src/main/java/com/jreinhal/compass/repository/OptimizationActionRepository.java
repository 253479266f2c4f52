package com.jreinhal.compass.repository;

import com.jreinhal.compass.model.OptimizationAction;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface OptimizationActionRepository extends MongoRepository<OptimizationAction, String> {

    List<OptimizationAction> findByPipelineRunIdOrderByCreatedAtAsc(String pipelineRunId);

    List<OptimizationAction> findBySchemaIdAndAppliedTrueAndRolledBackFalseOrderByCreatedAtDesc(String schemaId);
}
