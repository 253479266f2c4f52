package com.jreinhal.compass.service;

import com.jreinhal.compass.autonomous.accuracy.RagExecutionResult;
import com.jreinhal.compass.autonomous.accuracy.RagQueryExecutor;
import com.jreinhal.compass.dto.QueryResponse;
import com.jreinhal.compass.dto.RetrievedRecord;
import com.jreinhal.compass.understanding.QueryContext;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Accuracy tests run against the same pipeline users hit.
 */
@Component
public class PipelineRagQueryExecutor implements RagQueryExecutor {

    private final QueryPipelineService pipelineService;

    public PipelineRagQueryExecutor(QueryPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Override
    public RagExecutionResult execute(String query, String namespace, Map<String, String> targetEntity) {
        Map<String, String> entity = targetEntity == null ? Map.of() : targetEntity;
        QueryContext context = new QueryContext(List.of(namespace), entity.get("employeeId"), null, List.of(),
                false, entity.get("period"), null);
        QueryResponse response = this.pipelineService.ask(query, context);
        if (response.blocked()) {
            throw new IllegalStateException("Pipeline blocked for namespace " + namespace + ": " + response.answer());
        }
        List<RetrievedRecord> sources = response.sources();
        Map<String, Object> extracted = sources.isEmpty() ? Map.of() : sources.get(0).metadata();
        return new RagExecutionResult(
                response.answer(),
                extracted,
                response.topScore(),
                response.avgScore(),
                response.filtersUsed(),
                sources.isEmpty() ? namespace : sources.get(0).namespace(),
                response.route(),
                response.intent() != null ? response.intent().intent() : null,
                response.intent() != null ? response.intent().confidence() : 0.0);
    }
}
