package com.phillippitts.mindscribe.config;

import com.phillippitts.mindscribe.config.properties.SessionProperties;
import com.phillippitts.mindscribe.config.properties.ThreadPoolProperties;
import com.phillippitts.mindscribe.config.properties.TranscriptionProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors backing the session pipeline.
 *
 * <ul>
 *   <li>{@code sessionCommandExecutor}: one thread, bounded queue, abort on overflow. Every
 *       session command is applied here in arrival order; callers never block.</li>
 *   <li>{@code pipelineExecutor}: runs one chunk-and-transcribe job per Transcribing session.</li>
 *   <li>{@code transcriptionExecutor}: segment workers, sized to
 *       {@code transcription.max-concurrent-segments}.</li>
 * </ul>
 *
 * <p>MDC propagation: each executor copies the Log4j2 ThreadContext from the submitting thread to
 * the worker so {@code sessionId} and {@code requestId} follow the work.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final TranscriptionProperties transcriptionProperties;
    private final SessionProperties sessionProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties,
                            TranscriptionProperties transcriptionProperties,
                            SessionProperties sessionProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.transcriptionProperties = transcriptionProperties;
        this.sessionProperties = sessionProperties;
    }

    /**
     * Segment workers. Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, so an
     * overflowing recording slows its own pipeline thread instead of failing.
     */
    @Bean(name = "transcriptionExecutor")
    public ThreadPoolTaskExecutor transcriptionExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getTranscription();
        int workers = transcriptionProperties.getMaxConcurrentSegments();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getPipeline();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Serialized command queue. Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; a full
     * queue surfaces as {@link org.springframework.core.task.TaskRejectedException} to the caller.
     */
    @Bean(name = "sessionCommandExecutor")
    public ThreadPoolTaskExecutor sessionCommandExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(sessionProperties.getCommandQueueCapacity());
        executor.setThreadNamePrefix(threadPoolProperties.getCommandThreadName());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
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
