package com.jreinhal.compass.repository;

import com.jreinhal.compass.model.PipelineRun;
import java.util.List;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PipelineRunRepository extends MongoRepository<PipelineRun, String> {

    List<PipelineRun> findTop10BySchemaIdOrderByStartedAtDesc(String schemaId);
}
