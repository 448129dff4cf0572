package com.phillippitts.callscribe.config;

import com.phillippitts.callscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for per-speaker capture and for session finalization.
 *
 * <p>Both pools reject with {@link ThreadPoolExecutor.AbortPolicy}. The session coordinator turns a
 * rejected capture into a counted drop and a rejected finalize into a failed session outcome.
 * Running the work on the caller would block the session loop.
 *
 * <p>MDC propagation: both pools copy the Log4j2 ThreadContext of the submitting thread so that
 * {@code sessionId} and {@code speakerId} appear in worker logs.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool running one blocking capture task per speaking segment.
     *
     * <p>Core and max size are equal so that queued work never waits behind a pool that refuses
     * to grow; idle threads still time out between calls. Captures are abandoned at shutdown
     * rather than awaited, since their audio sources are closed by the coordinator first.
     */
    @Bean(name = "captureExecutor")
    public ThreadPoolTaskExecutor captureExecutor() {
        ThreadPoolProperties.CapturePoolProperties props = threadPoolProperties.getCapture();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getPoolSize());
        executor.setMaxPoolSize(props.getPoolSize());
        executor.setAllowCoreThreadTimeOut(true);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Pool running summarization and delivery. Finishing deliveries are awaited on shutdown.
     */
    @Bean(name = "finalizeExecutor")
    public ThreadPoolTaskExecutor finalizeExecutor() {
        ThreadPoolProperties.FinalizePoolProperties props = threadPoolProperties.getFinalize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
