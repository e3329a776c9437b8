package com.phillippitts.aerodefect.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>{@code threadpool.detector.*} sizes the local inference pool and {@code threadpool.remote.*}
 * the pool for remote vision calls. Each job puts one branch on each, so both should hold at least
 * {@code inspection.max-concurrent-jobs} threads. The remote pool has no queue by default: when every
 * thread is busy the remote branch fails at once instead of waiting.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private DetectorPoolProperties detector = new DetectorPoolProperties();
    private DetectorPoolProperties remote = DetectorPoolProperties.remoteDefaults();

    public DetectorPoolProperties getDetector() {
        return detector;
    }

    public void setDetector(DetectorPoolProperties detector) {
        this.detector = detector;
    }

    public DetectorPoolProperties getRemote() {
        return remote;
    }

    public void setRemote(DetectorPoolProperties remote) {
        this.remote = remote;
    }

    /**
     * Detector executor pool configuration.
     */
    public static class DetectorPoolProperties {
        private int corePoolSize = 10;
        private int maxPoolSize = 20;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "detector-pool-";

        static DetectorPoolProperties remoteDefaults() {
            DetectorPoolProperties remote = new DetectorPoolProperties();
            remote.setQueueCapacity(0);
            remote.setThreadNamePrefix("remote-detector-pool-");
            return remote;
        }

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
