package com.phillippitts.livefacts.config;

import com.phillippitts.livefacts.service.tracking.SessionRegistry;
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
 * Exposes session and generation pool usage via Micrometer.
 *
 * <ul>
 *   <li>livefacts.tracking.sessions.active - users currently tracked</li>
 *   <li>livefacts.pool.session.active - busy session threads (two per tracked user)</li>
 *   <li>livefacts.pool.session.max.size - configured session pool limit</li>
 *   <li>livefacts.pool.generation.active / queued - in-flight and waiting generation calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> generationExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("sessionExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider,
            @Qualifier("generationExecutor") ObjectProvider<ThreadPoolTaskExecutor> generationExecutorProvider) {
        this.sessionExecutorProvider = sessionExecutorProvider;
        this.generationExecutorProvider = generationExecutorProvider;
    }

    @Bean
    public MeterBinder trackingPoolMetrics(ObjectProvider<SessionRegistry> registryProvider) {
        return registry -> {
            ThreadPoolExecutor session = sessionExecutorProvider.getObject().getThreadPoolExecutor();
            ThreadPoolExecutor generation = generationExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("livefacts.tracking.sessions.active", registryProvider,
                            p -> p.getObject().activeCount())
                    .description("Users currently tracked")
                    .register(registry);

            Gauge.builder("livefacts.pool.session.active", session, ThreadPoolExecutor::getActiveCount)
                    .description("Threads running delivery loops and health monitors")
                    .register(registry);

            Gauge.builder("livefacts.pool.session.max.size", session, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum size of the session pool")
                    .register(registry);

            Gauge.builder("livefacts.pool.generation.active", generation, ThreadPoolExecutor::getActiveCount)
                    .description("Content generation calls in flight")
                    .register(registry);

            Gauge.builder("livefacts.pool.generation.queued", generation, e -> e.getQueue().size())
                    .description("Content generation calls waiting in the queue")
                    .register(registry);

            LOG.info("Tracking pool metrics registered: livefacts.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor session = sessionExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor generation = generationExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Pool health: session active={}/{}, generation active={}/{} queued={}",
                session.getActiveCount(),
                session.getMaximumPoolSize(),
                generation.getActiveCount(),
                generation.getMaximumPoolSize(),
                generation.getQueue().size()
        );
    }
}
