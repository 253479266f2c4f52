package com.jreinhal.compass.controller;

import com.jreinhal.compass.config.PipelineExecutorConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Thread pool statistics for the schema regeneration pools.
 *
 * <p>A growing {@code rejectionCount} on the discovery pool means regenerations are being
 * failed for lack of capacity; raise {@code compass.pipeline.discovery-threads} or the queue
 * capacity.</p>
 */
@RestController
@RequestMapping("/api/pipeline/executor-stats")
public class ExecutorStatsController {

    private final ThreadPoolExecutor discoveryExecutor;
    private final ScheduledThreadPoolExecutor schemaUpdateScheduler;

    public ExecutorStatsController(
            @Qualifier("discoveryExecutor") ThreadPoolExecutor discoveryExecutor,
            @Qualifier("schemaUpdateScheduler") ScheduledThreadPoolExecutor schemaUpdateScheduler) {
        this.discoveryExecutor = discoveryExecutor;
        this.schemaUpdateScheduler = schemaUpdateScheduler;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("discoveryExecutor", buildPoolStats(this.discoveryExecutor));
        stats.put("schemaUpdateScheduler", buildPoolStats(this.schemaUpdateScheduler));
        return ResponseEntity.ok(stats);
    }

    private Map<String, Object> buildPoolStats(ThreadPoolExecutor executor) {
        Map<String, Object> pool = new LinkedHashMap<>();
        pool.put("corePoolSize", executor.getCorePoolSize());
        pool.put("activeThreads", executor.getActiveCount());
        pool.put("currentPoolSize", executor.getPoolSize());
        pool.put("queueSize", executor.getQueue().size());
        pool.put("queueRemainingCapacity", executor.getQueue().remainingCapacity());
        pool.put("completedTaskCount", executor.getCompletedTaskCount());
        pool.put("totalTaskCount", executor.getTaskCount());
        if (executor.getRejectedExecutionHandler() instanceof PipelineExecutorConfig.MonitoredRejectionHandler handler) {
            pool.put("rejectionCount", handler.getRejectionCount());
        }
        return pool;
    }
}
