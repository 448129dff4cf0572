package com.phillippitts.callscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The capture pool holds one thread per speaker for the whole length of a segment, so its
 * size should match {@code session.max-concurrent-captures}. The finalize pool runs
 * summarization and delivery, one session at a time in practice.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private CapturePoolProperties capture = new CapturePoolProperties();
    private FinalizePoolProperties finalize = new FinalizePoolProperties();

    public CapturePoolProperties getCapture() {
        return capture;
    }

    public void setCapture(CapturePoolProperties capture) {
        this.capture = capture;
    }

    public FinalizePoolProperties getFinalize() {
        return finalize;
    }

    public void setFinalize(FinalizePoolProperties finalize) {
        this.finalize = finalize;
    }

    /**
     * Capture executor pool configuration. Core and max size are equal; idle threads time out.
     */
    public static class CapturePoolProperties {
        private int poolSize = 32;
        private int queueCapacity = 32;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "capture-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Finalize executor pool configuration.
     */
    public static class FinalizePoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 8;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "finalize-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
