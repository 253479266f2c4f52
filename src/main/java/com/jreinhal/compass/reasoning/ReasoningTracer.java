package com.jreinhal.compass.reasoning;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);
    private static final int MAX_CACHED_TRACES = 1000;

    @Value("${compass.reasoning.enabled:true}")
    private boolean enabled;
    @Value("${compass.reasoning.detailed-traces:false}")
    private boolean detailedTraces;
    private final ThreadLocal<ReasoningTrace> currentTrace = new ThreadLocal<>();
    private final Map<String, ReasoningTrace> traceCache = new ConcurrentHashMap<>();

    public ReasoningTrace startTrace(String query, List<String> namespaces) {
        return this.startTrace(query, namespaces, null);
    }

    public ReasoningTrace startTrace(String query, List<String> namespaces, String userId) {
        if (!this.enabled) {
            return null;
        }
        ReasoningTrace trace = new ReasoningTrace(query, namespaces, userId);
        this.currentTrace.set(trace);
        log.debug("Started reasoning trace: {} for namespaces: {}", trace.getTraceId(), namespaces);
        return trace;
    }

    public ReasoningTrace getCurrentTrace() {
        return this.currentTrace.get();
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(type, label, detail, durationMs, Map.of());
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return;
        }
        trace.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
        if (this.detailedTraces) {
            log.debug("Trace[{}] Step: {} - {} ({}ms)", trace.getTraceId(), type, label, durationMs);
        }
    }

    public void addMetric(String key, Object value) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace != null) {
            trace.addMetric(key, value);
        }
    }

    public ReasoningTrace endTrace() {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return null;
        }
        trace.complete();
        this.currentTrace.remove();
        this.cacheTrace(trace);
        log.debug("Completed reasoning trace: {}", trace.getSummary());
        return trace;
    }

    public ReasoningTrace getTrace(String traceId) {
        return this.traceCache.get(traceId);
    }

    private void cacheTrace(ReasoningTrace trace) {
        if (this.traceCache.size() >= MAX_CACHED_TRACES) {
            this.traceCache.keySet().stream().limit(100L).toList().forEach(this.traceCache::remove);
        }
        this.traceCache.put(trace.getTraceId(), trace);
    }

    public void clearCache() {
        this.traceCache.clear();
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
