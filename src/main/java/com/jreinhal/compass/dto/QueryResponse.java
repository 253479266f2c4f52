package com.jreinhal.compass.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.compass.calculation.CalculationOutcome;
import com.jreinhal.compass.pipeline.PipelineStatus;
import com.jreinhal.compass.router.RouteType;
import com.jreinhal.compass.understanding.QueryIntent;
import java.util.List;
import java.util.Map;

/**
 * Everything the pipeline produced for one query. {@code status} is set when the gate blocked
 * the query; {@code intent} is absent for instant and router-level fallback answers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(String answer,
                            RouteType route,
                            String clarifyQuestion,
                            QueryIntent intent,
                            PipelineStatus status,
                            List<RetrievedRecord> sources,
                            Map<String, Object> filtersUsed,
                            double topScore,
                            double avgScore,
                            CalculationOutcome calculation,
                            List<Map<String, Object>> reasoning,
                            String traceId,
                            long processingTimeMs) {

    public QueryResponse {
        sources = sources == null ? List.of() : List.copyOf(sources);
        filtersUsed = filtersUsed == null ? Map.of() : filtersUsed;
        reasoning = reasoning == null ? List.of() : reasoning;
    }

    public boolean blocked() {
        return status != null && status.blocked();
    }
}
