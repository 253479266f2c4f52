package com.jreinhal.compass.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools behind schema regeneration.
 *
 * <p>{@code schemaUpdateScheduler} runs debounce and settle delays only; the actual discovery
 * work is handed to {@code discoveryExecutor} so a slow vector store never delays timers.</p>
 *
 * <p>The discovery pool rejects instead of running on the caller, since callers are
 * scheduler threads.</p>
 */
@Configuration
public class PipelineExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutorConfig.class);

    @Bean(name = {"discoveryExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor discoveryExecutor(
            @Value("${compass.pipeline.discovery-threads:2}") int threads,
            @Value("${compass.pipeline.discovery-queue-capacity:100}") int queueCapacity) {
        int core = Math.max(1, threads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, core, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory("schema-discovery-"),
                new MonitoredRejectionHandler("schema-discovery-"));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool 'schema-discovery-' initialized: core={}, queue={}", core, queue);
        return executor;
    }

    @Bean(name = {"schemaUpdateScheduler"}, destroyMethod = "shutdown")
    public ScheduledThreadPoolExecutor schemaUpdateScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("schema-update-"));
        // Cancelled debounce timers must not pile up in the queue.
        scheduler.setRemoveOnCancelPolicy(true);
        log.info("Scheduler 'schema-update-' initialized");
        return scheduler;
    }

    /**
     * Rejection handler that logs overload conditions and throws {@link RejectedExecutionException}.
     */
    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}': active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(),
                    executor.getQueue().size(), count);
            throw new RejectedExecutionException(
                    "Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
