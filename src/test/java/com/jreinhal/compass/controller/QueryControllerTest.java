package com.jreinhal.compass.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.jreinhal.compass.dto.QueryRequest;
import com.jreinhal.compass.dto.QueryResponse;
import com.jreinhal.compass.reasoning.QueryMetricsRecorder;
import com.jreinhal.compass.reasoning.ReasoningTrace;
import com.jreinhal.compass.reasoning.ReasoningTracer;
import com.jreinhal.compass.router.QueryRouterService;
import com.jreinhal.compass.router.RouteType;
import com.jreinhal.compass.service.QueryPipelineService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class QueryControllerTest {

    @Test
    void queryDelegatesToPipeline() {
        QueryPipelineService pipeline = mock(QueryPipelineService.class);
        QueryRequest request = new QueryRequest("이번달 수수료", List.of("commission"), "1001", null, null, false, null, null);
        QueryResponse response = new QueryResponse("총 커미션: 1,000", RouteType.RAG, null, null, null, List.of(),
                Map.of(), 0.9, 0.9, null, List.of(), "trace-01", 5);
        when(pipeline.ask(request)).thenReturn(response);
        QueryController controller = new QueryController(pipeline, mock(QueryRouterService.class),
                mock(ReasoningTracer.class), new QueryMetricsRecorder());

        assertSame(response, controller.query(request));
    }

    @Test
    void reasoningTraceLookup() {
        ReasoningTracer tracer = mock(ReasoningTracer.class);
        ReasoningTrace trace = new ReasoningTrace("이번달 수수료", List.of("commission"));
        when(tracer.getTrace("known")).thenReturn(trace);
        QueryController controller = new QueryController(mock(QueryPipelineService.class),
                mock(QueryRouterService.class), tracer, new QueryMetricsRecorder());

        ResponseEntity<Map<String, Object>> found = controller.getReasoningTrace("known");
        ResponseEntity<Map<String, Object>> missing = controller.getReasoningTrace("missing");

        assertEquals(HttpStatus.OK, found.getStatusCode());
        assertEquals(trace.getTraceId(), found.getBody().get("traceId"));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("Trace not found", missing.getBody().get("error"));
    }

    @Test
    void metricsExposeRecorderSnapshot() {
        QueryMetricsRecorder recorder = new QueryMetricsRecorder();
        recorder.record(new QueryMetricsRecorder.QueryMetric("instant", null, null, 1.0, false, 0, 1L));
        QueryController controller = new QueryController(mock(QueryPipelineService.class),
                mock(QueryRouterService.class), mock(ReasoningTracer.class), recorder);

        assertEquals(1L, controller.metrics().get("totalQueries"));
    }
}
