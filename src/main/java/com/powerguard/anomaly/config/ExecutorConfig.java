package com.powerguard.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * Bounded pool for the per-meter stages of a detection run (feature extraction, result writes).
     * The batch fit/score stage runs on the calling thread.
     */
    @Bean(name = "detectionWorkerPool", destroyMethod = "shutdown")
    public ExecutorService detectionWorkerPool(DetectionConfig config) {
        int threads = config.getWorkerThreads() > 0
                ? config.getWorkerThreads()
                : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "detection-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
