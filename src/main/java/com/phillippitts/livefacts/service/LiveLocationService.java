package com.phillippitts.livefacts.service;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.service.delivery.NotificationKind;
import com.phillippitts.livefacts.service.tracking.SessionNotifier;
import com.phillippitts.livefacts.service.tracking.SessionRegistry;
import com.phillippitts.livefacts.service.tracking.SessionRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for already-decoded live-location signals from a messaging front end.
 *
 * <p>Maps client signals onto {@link SessionRegistry} operations:
 * <ul>
 *   <li>a live location with a chosen fact interval begins tracking and confirms it</li>
 *   <li>an edited live location is a position update</li>
 *   <li>a plain (non-live) location from a tracked user means sharing was stopped; the
 *       session is stopped and the stop is confirmed</li>
 * </ul>
 */
@Service
public class LiveLocationService {

    private static final Logger LOG = LogManager.getLogger(LiveLocationService.class);

    private final SessionRegistry registry;
    private final SessionNotifier notifier;
    private final TrackingProperties props;

    public LiveLocationService(SessionRegistry registry, SessionNotifier notifier, TrackingProperties props) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Begins tracking after the user chose how often to receive facts.
     *
     * @param livePeriodSeconds       how long the client will share its location
     * @param deliveryIntervalMinutes chosen cadence
     * @param locale                  user language, or {@code null} for the configured default
     * @throws com.phillippitts.livefacts.exception.SessionStartException if tracking could not start;
     *         the activation message has already been sent by then and the caller reports the failure
     */
    public void beginTracking(String userId,
                              String destinationId,
                              Coordinates position,
                              long livePeriodSeconds,
                              int deliveryIntervalMinutes,
                              Locale locale) {
        Locale effective = locale == null ? props.defaultLocale() : locale;
        SessionRequest request = new SessionRequest(userId, destinationId, position,
                Duration.ofSeconds(livePeriodSeconds),
                Duration.ofMinutes(deliveryIntervalMinutes),
                effective,
                props.isImmediateFirstDelivery());
        // Confirmed first: with immediate delivery the first fact can go out as soon as start spawns the loop
        notifier.notify(destinationId, NotificationKind.ACTIVATED, effective,
                String.valueOf(livePeriodSeconds / 60), String.valueOf(deliveryIntervalMinutes));
        registry.start(request);
    }

    /**
     * Forwards a live position update. Untracked users are ignored.
     */
    public void onLivePosition(String userId, Coordinates position) {
        registry.updatePosition(userId, position);
    }

    /**
     * Handles a plain location message.
     *
     * @return {@code true} if it ended an active session (and the stop was confirmed);
     *         {@code false} if the user was not tracked and the caller should treat it as a
     *         one-off location request
     */
    public boolean onStaticLocation(String userId, String destinationId, Locale locale) {
        if (!registry.stop(userId)) {
            return false;
        }
        LOG.info("Static location from tracked user {} treated as stop signal", userId);
        notifier.notify(destinationId, NotificationKind.STOPPED, locale == null ? props.defaultLocale() : locale);
        return true;
    }

    /**
     * Stops tracking on an explicit user request and confirms it.
     *
     * @return {@code true} if a session was stopped
     */
    public boolean stopTracking(String userId, String destinationId, Locale locale) {
        return onStaticLocation(userId, destinationId, locale);
    }
}
