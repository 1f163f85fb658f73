package com.phillippitts.livefacts.config;

import com.phillippitts.livefacts.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used by tracking sessions.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and expected number of tracked users.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool that runs per-session delivery loops and health monitors.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.session.*} properties:
     * <ul>
     *   <li>Core pool: default 8</li>
     *   <li>Max pool: default 512 - two threads per tracked user</li>
     *   <li>Queue: none - a session task that cannot start immediately is rejected</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected submission
     * surfaces as a session start failure; queueing a long-running loop behind other loops
     * would silently delay its first delivery by hours.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so that start-time correlation values survive into the loops.
     *
     * @return Configured executor for session tasks
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        ThreadPoolProperties.SessionPoolProperties sessionProps = threadPoolProperties.getSession();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sessionProps.getCorePoolSize());
        executor.setMaxPoolSize(sessionProps.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(sessionProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(sessionProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // Loops run until cancelled; shutdown interrupts them instead of waiting
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());

        executor.initialize();
        return executor;
    }

    /**
     * Creates a bounded thread pool for content generation calls.
     *
     * <p>Delivery loops wait on these calls with a timeout, so a slow generator never pins
     * a session thread beyond {@code tracking.generation-timeout}.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected call is
     * reported as a generation failure and the loop delivers a placeholder.
     *
     * @return Configured executor for content generation
     */
    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor() {
        ThreadPoolProperties.GenerationPoolProperties genProps = threadPoolProperties.getGeneration();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(genProps.getCorePoolSize());
        executor.setMaxPoolSize(genProps.getMaxPoolSize());
        executor.setQueueCapacity(genProps.getQueueCapacity());
        executor.setThreadNamePrefix(genProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(genProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());

        executor.initialize();
        return executor;
    }

    private static TaskDecorator mdcPropagatingDecorator() {
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
