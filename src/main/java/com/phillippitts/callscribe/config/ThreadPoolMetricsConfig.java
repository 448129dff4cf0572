package com.phillippitts.callscribe.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes capture and finalize pool gauges via Micrometer.
 *
 * <p>Gauges are named {@code callscribe.pool.<name>} and tagged {@code pool=capture|finalize}:
 * <ul>
 *   <li>callscribe.pool.size - current number of threads</li>
 *   <li>callscribe.pool.active - threads executing a task</li>
 *   <li>callscribe.pool.queued - tasks waiting in the queue</li>
 *   <li>callscribe.pool.completed - cumulative completed tasks</li>
 *   <li>callscribe.pool.max.size - configured maximum</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> captureExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> finalizeExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("captureExecutor") ObjectProvider<ThreadPoolTaskExecutor> captureExecutorProvider,
            @Qualifier("finalizeExecutor") ObjectProvider<ThreadPoolTaskExecutor> finalizeExecutorProvider) {
        this.captureExecutorProvider = captureExecutorProvider;
        this.finalizeExecutorProvider = finalizeExecutorProvider;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "capture", captureExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "finalize", finalizeExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Executor pool metrics registered: callscribe.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("callscribe.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("callscribe.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("callscribe.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("callscribe.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("callscribe.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .tag("pool", pool)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor capture = captureExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor finalize = finalizeExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Pool health: capture size={}/{} active={} queued={}; finalize size={}/{} active={} queued={}",
                capture.getPoolSize(), capture.getMaximumPoolSize(), capture.getActiveCount(),
                capture.getQueue().size(),
                finalize.getPoolSize(), finalize.getMaximumPoolSize(), finalize.getActiveCount(),
                finalize.getQueue().size());
    }
}
