package com.jreinhal.docqa.config;

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
 * Worker pool for per-session searches fanned out by one ask or compare request.
 *
 * <p>A full queue rejects with {@link RejectedExecutionException} rather than running the task
 * on the request thread.</p>
 */
@Configuration
public class RagPerformanceConfig {
    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);

    @Bean(name = {"ragExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ragExecutor(
            @Value("${docqa.performance.rag-core-threads:4}") int coreThreads,
            @Value("${docqa.performance.rag-max-threads:8}") int maxThreads,
            @Value("${docqa.performance.rag-queue-capacity:200}") int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory("rag-search-"), new MonitoredRejectionHandler("rag-search"));
        executor.allowCoreThreadTimeOut(true);
        log.info("Search pool initialized: core={}, max={}, queue={}", core, max, queue);
        return executor;
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        public MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Search task rejected from pool '{}': active={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Pool '" + this.poolName + "' is saturated (" + count + " rejections)");
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
