package com.jreinhal.compass.reasoning;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryMetricsRecorderTest {

    @Test
    void snapshotAggregatesRoutesIntentsAndLatency() {
        QueryMetricsRecorder recorder = new QueryMetricsRecorder();
        recorder.record(new QueryMetricsRecorder.QueryMetric("RAG", "direct_lookup", "commission", 0.9, false, 3, 100L));
        recorder.record(new QueryMetricsRecorder.QueryMetric("RAG", "calculation", "commission", 0.8, false, 5, 300L));
        recorder.record(new QueryMetricsRecorder.QueryMetric("INSTANT", null, null, 1.0, false, 0, 2L));
        recorder.record(new QueryMetricsRecorder.QueryMetric("RAG", null, null, 0.0, true, 0, 4L));

        Map<String, Object> snapshot = recorder.snapshot();

        assertEquals(4L, snapshot.get("totalQueries"));
        assertEquals(1L, snapshot.get("blockedQueries"));
        assertEquals(101L, snapshot.get("avgLatencyMs"));
        assertEquals(300L, snapshot.get("maxLatencyMs"));
        assertEquals(Map.of("INSTANT", 1L, "RAG", 3L), snapshot.get("routes"));
        assertEquals(Map.of("calculation", 1L, "direct_lookup", 1L), snapshot.get("intents"));
    }

    @Test
    void resetClearsEverything() {
        QueryMetricsRecorder recorder = new QueryMetricsRecorder();
        recorder.record(new QueryMetricsRecorder.QueryMetric("RAG", "sum", null, 0.7, false, 1, 50L));

        recorder.reset();

        assertEquals(0L, recorder.totalQueries());
        assertEquals(0L, recorder.snapshot().get("avgLatencyMs"));
        assertEquals(Map.of(), recorder.snapshot().get("routes"));
    }
}
