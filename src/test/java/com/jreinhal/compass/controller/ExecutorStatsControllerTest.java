package com.jreinhal.compass.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.jreinhal.compass.config.PipelineExecutorConfig;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutorStatsControllerTest {

    private ThreadPoolExecutor discoveryExecutor;
    private ScheduledThreadPoolExecutor scheduler;

    @BeforeEach
    void setUp() {
        discoveryExecutor = new PipelineExecutorConfig().discoveryExecutor(1, 10);
        scheduler = new PipelineExecutorConfig().schemaUpdateScheduler();
    }

    @AfterEach
    void tearDown() {
        discoveryExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    @SuppressWarnings("unchecked")
    void reportsRejectionsOfTheDiscoveryPool() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocked = () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        for (int i = 0; i < 11; i++) {
            discoveryExecutor.execute(blocked);
        }
        assertThrows(RejectedExecutionException.class, () -> discoveryExecutor.execute(blocked));

        Map<String, Object> stats = new ExecutorStatsController(discoveryExecutor, scheduler).getStats().getBody();
        release.countDown();

        Map<String, Object> discovery = (Map<String, Object>) stats.get("discoveryExecutor");
        assertEquals(1L, discovery.get("rejectionCount"));
        assertEquals(10, discovery.get("queueSize"));
        assertEquals(1, discovery.get("corePoolSize"));
        Map<String, Object> timers = (Map<String, Object>) stats.get("schemaUpdateScheduler");
        assertFalse(timers.containsKey("rejectionCount"));
    }
}
