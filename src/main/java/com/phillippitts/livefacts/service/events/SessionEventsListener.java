package com.phillippitts.livefacts.service.events;

import com.phillippitts.livefacts.service.metrics.TrackingMetrics;
import com.phillippitts.livefacts.service.tracking.event.DeliveryAttemptedEvent;
import com.phillippitts.livefacts.service.tracking.event.SessionEndedEvent;
import com.phillippitts.livefacts.service.tracking.event.SessionStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns session lifecycle events into metrics and operator-facing logs.
 * Channel failure warnings are throttled per user to avoid log spam.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final TrackingMetrics metrics;

    SessionEventsListener(TrackingMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onSessionStarted(SessionStartedEvent e) {
        metrics.incrementSessionStarted();
    }

    @EventListener
    void onSessionEnded(SessionEndedEvent e) {
        metrics.incrementSessionEnded(e.reason().name().toLowerCase(Locale.ROOT));
        lastLog.remove("channel-" + e.userId());
    }

    @EventListener
    void onDeliveryAttempted(DeliveryAttemptedEvent e) {
        metrics.incrementDelivery(e.outcome().name().toLowerCase(Locale.ROOT));
        if (e.outcome() == DeliveryAttemptedEvent.Outcome.CHANNEL_FAILED && shouldLog("channel-" + e.userId())) {
            LOG.warn("Delivery channel failing for user {} (message #{}). Check transport credentials "
                    + "and whether the destination still accepts messages.", e.userId(), e.number());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
