package com.jreinhal.compass.understanding;

import com.jreinhal.compass.pipeline.PipelineStatus;
import java.util.List;

/**
 * Output of query understanding. When the pipeline gate is closed the result carries the
 * blocked status and no intent.
 */
public record UnderstandingResult(
        QueryIntent intent,
        PipelineStatus status,
        long processingTimeMs,
        String modelUsed,
        List<String> schemasUsed) {

    public UnderstandingResult {
        schemasUsed = schemasUsed == null ? List.of() : List.copyOf(schemasUsed);
    }

    public static UnderstandingResult blocked(PipelineStatus status, long processingTimeMs) {
        return new UnderstandingResult(null, status, processingTimeMs, null, List.of());
    }

    public boolean isBlocked() {
        return status != null && status.blocked();
    }
}
