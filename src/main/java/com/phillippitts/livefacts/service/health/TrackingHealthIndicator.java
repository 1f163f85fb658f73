package com.phillippitts.livefacts.service.health;

import com.phillippitts.livefacts.service.tracking.SessionRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Health indicator for live-location tracking.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: session pool has headroom for new sessions</li>
 *   <li>DEGRADED: session pool is at least 90% busy</li>
 *   <li>DOWN: session pool is full; new sessions will be rejected</li>
 * </ul>
 *
 * <p>Contributes to the actuator {@code health} endpoint.
 */
@Component
public class TrackingHealthIndicator implements HealthIndicator {

    private static final double DEGRADED_RATIO = 0.9;

    private final SessionRegistry registry;
    private final ThreadPoolTaskExecutor sessionExecutor;

    public TrackingHealthIndicator(SessionRegistry registry,
                                   @Qualifier("sessionExecutor") ThreadPoolTaskExecutor sessionExecutor) {
        this.registry = registry;
        this.sessionExecutor = sessionExecutor;
    }

    @Override
    public Health health() {
        int active = sessionExecutor.getActiveCount();
        int max = sessionExecutor.getMaxPoolSize();
        double busy = max == 0 ? 1.0 : (double) active / max;

        Health.Builder builder;
        if (active >= max) {
            builder = Health.down().withDetail("status", "Session pool full");
        } else if (busy >= DEGRADED_RATIO) {
            builder = Health.status("DEGRADED").withDetail("status", "Session pool nearly full");
        } else {
            builder = Health.up().withDetail("status", "Accepting sessions");
        }
        return builder
                .withDetail("activeSessions", registry.activeCount())
                .withDetail("busyThreads", active)
                .withDetail("maxThreads", max)
                .build();
    }
}
