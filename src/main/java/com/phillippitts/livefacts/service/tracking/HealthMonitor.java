package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.Objects;

/**
 * Polls one session for position silence at a fixed short period.
 *
 * <p>The delivery loop only looks at the session between deliveries, which may be an hour
 * apart. This monitor bounds silence detection by {@code tracking.health-poll-interval}
 * instead: once the last position update is older than {@code tracking.silence-threshold}
 * it ends the session as SILENT (the destination gets a "manual stop" notification) and
 * cancels the delivery loop, whose exit removes the registry entry.
 *
 * <p>On expiry the monitor just stops; the delivery loop owns the expiry notification.
 */
public final class HealthMonitor implements Runnable {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    private final SessionState state;
    private final TrackingProperties props;
    private final SessionNotifier notifier;

    HealthMonitor(SessionState state, TrackingProperties props, SessionNotifier notifier) {
        this.state = Objects.requireNonNull(state, "state");
        this.props = Objects.requireNonNull(props, "props");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    @Override
    public void run() {
        ThreadContext.put("userId", state.userId());
        ThreadContext.put("task", "monitor");
        try {
            poll();
        } catch (InterruptedException ie) {
            LOG.debug("Health monitor cancelled (phase={})", state.phase());
        } catch (RuntimeException unexpected) {
            LOG.error("Health monitor terminated by unexpected error", unexpected);
        } finally {
            ThreadContext.remove("task");
            ThreadContext.remove("userId");
        }
    }

    private void poll() throws InterruptedException {
        while (true) {
            TimeUtils.sleep(props.getHealthPollInterval());
            if (!state.isActive()) {
                return;
            }
            Instant now = Instant.now();
            if (state.isExpiredAt(now)) {
                return;
            }
            if (state.positionFix().isSilentAt(now, props.getSilenceThreshold())) {
                LOG.info("No position update since {}, ending session", state.lastUpdateTime());
                notifier.end(state, SessionPhase.SILENT);
                cancelDelivery();
                return;
            }
        }
    }

    private void cancelDelivery() {
        SessionTask delivery = state.deliveryTask();
        if (delivery != null) {
            delivery.cancel();
        }
    }
}
