package com.phillippitts.livefacts.service.tracking.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted by a delivery loop after each delivery cycle.
 *
 * <p>PII note: carries no generated text and no coordinates.
 *
 * @param userId  tracked user
 * @param number  user-visible message number
 * @param outcome what the cycle achieved
 * @param latency time spent in the cycle (generation plus delivery)
 * @param at      when the cycle finished
 */
public record DeliveryAttemptedEvent(
        String userId,
        int number,
        Outcome outcome,
        Duration latency,
        Instant at
) {

    public enum Outcome {
        /** Generated content was delivered. */
        DELIVERED,
        /** Generation failed; a numbered placeholder was delivered. */
        PLACEHOLDER,
        /** The delivery channel failed; the user most likely saw nothing. */
        CHANNEL_FAILED
    }
}
