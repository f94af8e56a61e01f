package com.jreinhal.covenant.controller;

import com.jreinhal.covenant.config.ExecutorConfig;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Live statistics for the worker pools: active threads, queue depth, completed tasks and
 * rejections. A growing rejection count on the ingestion pool means uploads are arriving
 * faster than documents can be extracted and embedded.
 */
@RestController
@RequestMapping("/api/admin/thread-pool-stats")
public class ThreadPoolStatsController {

    private final ThreadPoolExecutor ingestionExecutor;
    private final ThreadPoolExecutor retrievalExecutor;
    private final ThreadPoolExecutor modelCallExecutor;

    public ThreadPoolStatsController(
            @Qualifier("ingestionExecutor") ThreadPoolExecutor ingestionExecutor,
            @Qualifier("retrievalExecutor") ThreadPoolExecutor retrievalExecutor,
            @Qualifier("modelCallExecutor") ThreadPoolExecutor modelCallExecutor) {
        this.ingestionExecutor = ingestionExecutor;
        this.retrievalExecutor = retrievalExecutor;
        this.modelCallExecutor = modelCallExecutor;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("ingestionExecutor", buildPoolStats(this.ingestionExecutor));
        stats.put("retrievalExecutor", buildPoolStats(this.retrievalExecutor));
        stats.put("modelCallExecutor", buildPoolStats(this.modelCallExecutor));
        return ResponseEntity.ok(stats);
    }

    private Map<String, Object> buildPoolStats(ThreadPoolExecutor executor) {
        Map<String, Object> pool = new LinkedHashMap<>();
        pool.put("poolSize", executor.getCorePoolSize());
        pool.put("activeThreads", executor.getActiveCount());
        pool.put("currentPoolSize", executor.getPoolSize());
        pool.put("queueSize", executor.getQueue().size());
        pool.put("queueRemainingCapacity", executor.getQueue().remainingCapacity());
        pool.put("completedTaskCount", executor.getCompletedTaskCount());
        pool.put("totalTaskCount", executor.getTaskCount());
        if (executor.getRejectedExecutionHandler() instanceof ExecutorConfig.MonitoredRejectionHandler handler) {
            pool.put("rejectionCount", handler.getRejectionCount());
        }
        return pool;
    }
}
