package com.phillippitts.livefacts.service.tracking.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted after a tracking session has been registered and both of its tasks are running.
 *
 * @param userId           tracked user
 * @param destinationId    delivery destination
 * @param trackingDuration requested lifetime
 * @param deliveryInterval requested cadence
 * @param replaced         {@code true} if an earlier session of the same user was stopped first
 * @param at               when the session started
 */
public record SessionStartedEvent(
        String userId,
        String destinationId,
        Duration trackingDuration,
        Duration deliveryInterval,
        boolean replaced,
        Instant at
) {}
