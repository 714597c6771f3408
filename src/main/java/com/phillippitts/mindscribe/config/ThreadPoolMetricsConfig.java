package com.phillippitts.mindscribe.config;

import io.micrometer.core.instrument.Gauge;
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
 * Exposes the segment worker pool via Micrometer:
 * <ul>
 *   <li>transcription.pool.size - Current number of threads in the pool</li>
 *   <li>transcription.pool.active - Number of segments being transcribed</li>
 *   <li>transcription.pool.queued - Number of segments waiting for a worker</li>
 *   <li>transcription.pool.completed - Cumulative count of completed segment tasks</li>
 *   <li>session.commands.queued - Commands waiting on the session command thread</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> transcriptionExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> commandExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("transcriptionExecutor") ObjectProvider<ThreadPoolTaskExecutor> transcriptionExecutorProvider,
            @Qualifier("sessionCommandExecutor") ObjectProvider<ThreadPoolTaskExecutor> commandExecutorProvider) {
        this.transcriptionExecutorProvider = transcriptionExecutorProvider;
        this.commandExecutorProvider = commandExecutorProvider;
    }

    @Bean
    public MeterBinder transcriptionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = transcriptionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("transcription.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the transcription pool")
                    .register(registry);

            Gauge.builder("transcription.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of segments being transcribed")
                    .register(registry);

            Gauge.builder("transcription.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of segments waiting for a worker")
                    .register(registry);

            Gauge.builder("transcription.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed segment tasks")
                    .register(registry);

            ThreadPoolExecutor commands = commandExecutorProvider.getObject().getThreadPoolExecutor();
            Gauge.builder("session.commands.queued", commands, e -> e.getQueue().size())
                    .description("Session commands waiting to be applied")
                    .register(registry);

            LOG.info("Thread pool metrics registered: transcription.pool.* available via /actuator/metrics");
        };
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = transcriptionExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Transcription Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
