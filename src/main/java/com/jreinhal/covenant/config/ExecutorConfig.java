package com.jreinhal.covenant.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
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
 * Thread pools for background ingestion, retrieval legs and model calls.
 *
 * <p>The ingestion pool is fixed-size: its thread count is the number of documents processed
 * concurrently, which bounds embedding-API concurrency and OCR load. Extraction, OCR and
 * embedding block inside these workers and never on request threads.</p>
 *
 * <p>All pools reject with {@link RejectedExecutionException} instead of running work on the
 * caller, so a saturated pool surfaces as HTTP 503 rather than a stalled request thread.</p>
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean(name = {"ingestionExecutor"}, destroyMethod = "shutdownNow")
    public ThreadPoolExecutor ingestionExecutor(IngestionProperties properties) {
        int workers = properties.getWorkerPoolSize();
        if (workers <= 0) {
            throw new IllegalStateException("covenant.ingestion.worker-pool-size must be positive");
        }
        return this.buildExecutor("ingest-", workers, workers, properties.getQueueCapacity());
    }

    @Bean(name = {"retrievalExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor retrievalExecutor(
            @Value("${covenant.performance.retrieval-threads:8}") int threads,
            @Value("${covenant.performance.retrieval-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("retrieve-", threads, threads, queueCapacity);
    }

    @Bean(name = {"modelCallExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor modelCallExecutor(
            @Value("${covenant.performance.model-call-threads:8}") int threads,
            @Value("${covenant.performance.model-call-queue-capacity:200}") int queueCapacity) {
        return this.buildExecutor("model-call-", threads, threads, queueCapacity);
    }

    private ThreadPoolExecutor buildExecutor(String prefix, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool '{}' initialized: core={}, max={}, queue={}", prefix, core, max, queue);
        return executor;
    }

    /**
     * Logs overload and throws {@link RejectedExecutionException}; keeps a running count for
     * the pool statistics endpoint.
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
            log.warn("Task rejected from pool '{}', queue full. active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(),
                    executor.getQueue().size(), count);
            throw new RejectedExecutionException(
                    "Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }

        public long getRejectionCount() {
            return this.rejectionCount.get();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
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
