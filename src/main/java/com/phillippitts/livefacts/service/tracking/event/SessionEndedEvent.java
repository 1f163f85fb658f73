package com.phillippitts.livefacts.service.tracking.event;

import com.phillippitts.livefacts.service.tracking.SessionPhase;

import java.time.Instant;

/**
 * Emitted once per session when its registry entry is removed.
 *
 * @param userId     tracked user
 * @param reason     terminal phase the session ended in
 * @param deliveries number of delivery attempts made during the session
 * @param at         when the entry was removed
 */
public record SessionEndedEvent(
        String userId,
        SessionPhase reason,
        int deliveries,
        Instant at
) {}
