package com.jreinhal.compass.reasoning;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class ReasoningTracerTest {

    private ReasoningTracer tracer;

    @BeforeEach
    void setUp() {
        tracer = new ReasoningTracer();
        ReflectionTestUtils.setField(tracer, "enabled", true);
    }

    @AfterEach
    void tearDown() {
        tracer.endTrace();
    }

    @Test
    @DisplayName("Should record steps on the current thread's trace and cache it on end")
    void shouldTraceAndCache() {
        ReasoningTrace started = tracer.startTrace("MDRT까지 얼마?", List.of("commission"));
        tracer.addStep(ReasoningStep.StepType.QUERY_ROUTING, "Route", "RAG", 3);
        tracer.addStep(ReasoningStep.StepType.CALCULATION, "Calc", "mdrt_gap", 7, Map.of("gap", 1.0));
        tracer.addMetric("resultCount", 2);

        ReasoningTrace ended = tracer.endTrace();

        assertThat(ended).isSameAs(started);
        assertThat(ended.isCompleted()).isTrue();
        assertThat(ended.getSteps()).hasSize(2);
        assertThat(ended.getMetrics()).containsEntry("resultCount", 2);
        assertThat(tracer.getCurrentTrace()).isNull();
        assertThat(tracer.getTrace(ended.getTraceId())).isSameAs(ended);
    }

    @Test
    @DisplayName("Steps without an active trace are ignored")
    void shouldIgnoreStepsWithoutTrace() {
        tracer.addStep(ReasoningStep.StepType.RETRIEVAL, "Search", "none", 1);
        tracer.addMetric("ignored", true);

        assertThat(tracer.endTrace()).isNull();
    }

    @Test
    @DisplayName("Disabled tracer does not start traces")
    void shouldNotStartWhenDisabled() {
        ReflectionTestUtils.setField(tracer, "enabled", false);

        assertThat(tracer.startTrace("query", List.of("commission"))).isNull();
        assertThat(tracer.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("clearCache drops completed traces")
    void shouldClearCache() {
        tracer.startTrace("query", List.of("commission"));
        ReasoningTrace trace = tracer.endTrace();

        tracer.clearCache();

        assertThat(tracer.getTrace(trace.getTraceId())).isNull();
    }
}
