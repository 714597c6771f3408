package com.phillippitts.mindscribe.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Three pools back the pipeline: segment workers for provider calls, a pipeline pool running
 * one chunk-and-transcribe job per session, and the single command thread that serializes every
 * session transition.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties transcription = new PoolProperties(3, 3, 50, "transcription-worker-");
    private PoolProperties pipeline = new PoolProperties(1, 2, 4, "transcription-pipeline-");
    private String commandThreadName = "session-command-";

    public PoolProperties getTranscription() {
        return transcription;
    }

    public void setTranscription(PoolProperties transcription) {
        this.transcription = transcription;
    }

    public PoolProperties getPipeline() {
        return pipeline;
    }

    public void setPipeline(PoolProperties pipeline) {
        this.pipeline = pipeline;
    }

    public String getCommandThreadName() {
        return commandThreadName;
    }

    public void setCommandThreadName(String commandThreadName) {
        this.commandThreadName = commandThreadName;
    }

    /**
     * Sizing of one executor.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
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
