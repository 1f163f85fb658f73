package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.domain.Coordinates;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Parameters of a tracking session, fixed at start.
 *
 * @param userId                 opaque user identifier
 * @param destinationId          opaque delivery destination (chat) identifier
 * @param initialPosition        first reported position
 * @param trackingDuration       requested session lifetime
 * @param deliveryInterval       requested cadence between deliveries
 * @param locale                 language for user-facing messages
 * @param immediateFirstDelivery run one delivery cycle before the initial wait
 */
public record SessionRequest(
        String userId,
        String destinationId,
        Coordinates initialPosition,
        Duration trackingDuration,
        Duration deliveryInterval,
        Locale locale,
        boolean immediateFirstDelivery
) {

    public SessionRequest {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(destinationId, "destinationId");
        Objects.requireNonNull(initialPosition, "initialPosition");
        Objects.requireNonNull(trackingDuration, "trackingDuration");
        Objects.requireNonNull(deliveryInterval, "deliveryInterval");
        if (trackingDuration.isNegative() || trackingDuration.isZero()) {
            throw new IllegalArgumentException("Tracking duration must be positive, got: " + trackingDuration);
        }
        if (deliveryInterval.isNegative() || deliveryInterval.isZero()) {
            throw new IllegalArgumentException("Delivery interval must be positive, got: " + deliveryInterval);
        }
        locale = locale == null ? Locale.ENGLISH : locale;
    }

    /**
     * Request in the units used by live-location clients: seconds of sharing and minutes
     * between facts. No immediate first delivery.
     */
    public static SessionRequest of(String userId,
                                    String destinationId,
                                    Coordinates initialPosition,
                                    long trackingDurationSeconds,
                                    int deliveryIntervalMinutes) {
        return new SessionRequest(userId, destinationId, initialPosition,
                Duration.ofSeconds(trackingDurationSeconds),
                Duration.ofMinutes(deliveryIntervalMinutes),
                Locale.ENGLISH,
                false);
    }

    public SessionRequest withLocale(Locale newLocale) {
        return new SessionRequest(userId, destinationId, initialPosition, trackingDuration,
                deliveryInterval, newLocale, immediateFirstDelivery);
    }

    public SessionRequest withImmediateFirstDelivery(boolean immediate) {
        return new SessionRequest(userId, destinationId, initialPosition, trackingDuration,
                deliveryInterval, locale, immediate);
    }
}
