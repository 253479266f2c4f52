package com.jreinhal.compass.controller;

import com.jreinhal.compass.dto.QueryRequest;
import com.jreinhal.compass.dto.QueryResponse;
import com.jreinhal.compass.reasoning.QueryMetricsRecorder;
import com.jreinhal.compass.reasoning.ReasoningTrace;
import com.jreinhal.compass.reasoning.ReasoningTracer;
import com.jreinhal.compass.router.QueryRouterService;
import com.jreinhal.compass.router.RouterDecision;
import com.jreinhal.compass.service.QueryPipelineService;
import com.jreinhal.compass.util.LogSanitizer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final QueryPipelineService pipelineService;
    private final QueryRouterService routerService;
    private final ReasoningTracer reasoningTracer;
    private final QueryMetricsRecorder metricsRecorder;

    public QueryController(QueryPipelineService pipelineService, QueryRouterService routerService,
                           ReasoningTracer reasoningTracer, QueryMetricsRecorder metricsRecorder) {
        this.pipelineService = pipelineService;
        this.routerService = routerService;
        this.reasoningTracer = reasoningTracer;
        this.metricsRecorder = metricsRecorder;
    }

    @PostMapping("/query")
    public QueryResponse query(@RequestBody QueryRequest request) {
        log.debug("Query request {} over {}", LogSanitizer.querySummary(request.query()), request.namespaces());
        return this.pipelineService.ask(request);
    }

    /**
     * Router decision only, without running understanding or retrieval.
     */
    @GetMapping("/route")
    public RouterDecision route(@RequestParam("q") String query) {
        return this.routerService.route(query);
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        return this.metricsRecorder.snapshot();
    }

    @GetMapping("/reasoning/{traceId}")
    public ResponseEntity<Map<String, Object>> getReasoningTrace(@PathVariable String traceId) {
        ReasoningTrace trace = this.reasoningTracer.getTrace(traceId);
        if (trace == null) {
            return ResponseEntity.status(404).body(Map.of("error", "Trace not found", "traceId", traceId));
        }
        return ResponseEntity.ok(trace.toMap());
    }
}
