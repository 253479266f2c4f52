package com.jreinhal.compass.reasoning;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aggregates route, intent and latency distributions across queries and writes one
 * structured log line per query.
 */
@Component
public class QueryMetricsRecorder {
    private static final Logger log = LoggerFactory.getLogger(QueryMetricsRecorder.class);

    private final Map<String, LongAdder> routeCounts = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> intentCounts = new ConcurrentHashMap<>();
    private final LongAdder totalQueries = new LongAdder();
    private final LongAdder blockedQueries = new LongAdder();
    private final AtomicLong totalLatencyMs = new AtomicLong(0L);
    private final AtomicLong maxLatencyMs = new AtomicLong(0L);

    public void record(QueryMetric metric) {
        this.totalQueries.increment();
        if (metric.blocked()) {
            this.blockedQueries.increment();
        }
        if (metric.route() != null) {
            this.routeCounts.computeIfAbsent(metric.route(), k -> new LongAdder()).increment();
        }
        if (metric.intent() != null) {
            this.intentCounts.computeIfAbsent(metric.intent(), k -> new LongAdder()).increment();
        }
        this.totalLatencyMs.addAndGet(metric.latencyMs());
        this.maxLatencyMs.accumulateAndGet(metric.latencyMs(), Math::max);
        log.info("query_metric route={} intent={} template={} confidence={} blocked={} results={} latencyMs={}",
                metric.route(), metric.intent(), metric.template(),
                String.format("%.2f", metric.confidence()), metric.blocked(), metric.resultCount(), metric.latencyMs());
    }

    public Map<String, Object> snapshot() {
        long total = this.totalQueries.sum();
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("totalQueries", total);
        snapshot.put("blockedQueries", this.blockedQueries.sum());
        snapshot.put("avgLatencyMs", total == 0 ? 0L : this.totalLatencyMs.get() / total);
        snapshot.put("maxLatencyMs", this.maxLatencyMs.get());
        snapshot.put("routes", toCounts(this.routeCounts));
        snapshot.put("intents", toCounts(this.intentCounts));
        return snapshot;
    }

    public long totalQueries() {
        return this.totalQueries.sum();
    }

    public void reset() {
        this.routeCounts.clear();
        this.intentCounts.clear();
        this.totalQueries.reset();
        this.blockedQueries.reset();
        this.totalLatencyMs.set(0L);
        this.maxLatencyMs.set(0L);
    }

    private static Map<String, Long> toCounts(Map<String, LongAdder> source) {
        Map<String, Long> counts = new TreeMap<>();
        source.forEach((key, adder) -> counts.put(key, adder.sum()));
        return counts;
    }

    public record QueryMetric(String route, String intent, String template, double confidence,
                              boolean blocked, int resultCount, long latencyMs) {
    }
}
