package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.domain.Coordinates;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A reported position together with the instant it was received. Published as one
 * value so readers never see a coordinate paired with another update's timestamp.
 *
 * @param position   reported coordinates
 * @param receivedAt when the update was applied
 */
public record PositionFix(Coordinates position, Instant receivedAt) {

    public PositionFix {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    /**
     * Returns {@code true} if more than {@code threshold} has passed since this fix.
     */
    public boolean isSilentAt(Instant now, Duration threshold) {
        return Duration.between(receivedAt, now).compareTo(threshold) > 0;
    }
}
