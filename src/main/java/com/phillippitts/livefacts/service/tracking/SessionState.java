package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.domain.Coordinates;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable record of one user's active tracking session.
 *
 * <p><b>Ownership:</b> the {@link SessionRegistry} entry owns this object; the session's
 * {@link DeliveryLoop} and {@link HealthMonitor} share it by reference.
 *
 * <p><b>Single writer per field:</b>
 * <ul>
 *   <li>{@code positionFix} (position + last update time) - written only by
 *       {@link SessionRegistry#updatePosition}</li>
 *   <li>{@code deliveryCount}, {@code history} - written only by the delivery loop</li>
 *   <li>{@code phase} - leaves ACTIVE exactly once, by compare-and-set from whichever
 *       party first decides the session is over</li>
 *   <li>task handles - written by the registry before the entry becomes visible</li>
 * </ul>
 * Readers take best-effort snapshots; no consistency is promised across fields.
 */
public final class SessionState {

    private final String userId;
    private final String destinationId;
    private final Instant sessionStart;
    private final Duration trackingDuration;
    private final Duration deliveryInterval;
    private final Locale locale;
    private final boolean immediateFirstDelivery;

    private volatile PositionFix positionFix;
    private final AtomicInteger deliveryCount = new AtomicInteger();
    private final ContentHistory history;
    private final AtomicReference<SessionPhase> phase = new AtomicReference<>(SessionPhase.ACTIVE);

    private volatile SessionTask deliveryTask;
    private volatile SessionTask monitorTask;

    SessionState(SessionRequest request, Instant now, int historyLimit) {
        Objects.requireNonNull(request, "request");
        this.userId = request.userId();
        this.destinationId = request.destinationId();
        this.sessionStart = now;
        this.trackingDuration = request.trackingDuration();
        this.deliveryInterval = request.deliveryInterval();
        this.locale = request.locale();
        this.immediateFirstDelivery = request.immediateFirstDelivery();
        this.positionFix = new PositionFix(request.initialPosition(), now);
        this.history = new ContentHistory(historyLimit);
    }

    public String userId() {
        return userId;
    }

    public String destinationId() {
        return destinationId;
    }

    public Instant sessionStart() {
        return sessionStart;
    }

    public Duration trackingDuration() {
        return trackingDuration;
    }

    public Duration deliveryInterval() {
        return deliveryInterval;
    }

    public Locale locale() {
        return locale;
    }

    public boolean immediateFirstDelivery() {
        return immediateFirstDelivery;
    }

    public Instant expiryInstant() {
        return sessionStart.plus(trackingDuration);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiryInstant());
    }

    public PositionFix positionFix() {
        return positionFix;
    }

    public Coordinates position() {
        return positionFix.position();
    }

    public Instant lastUpdateTime() {
        return positionFix.receivedAt();
    }

    void updatePosition(Coordinates position, Instant at) {
        this.positionFix = new PositionFix(position, at);
    }

    public int deliveryCount() {
        return deliveryCount.get();
    }

    int nextDeliveryNumber() {
        return deliveryCount.incrementAndGet();
    }

    void recordContent(String entry) {
        history.append(entry);
    }

    List<String> exclusionList(int window) {
        return history.recent(window);
    }

    public List<String> contentHistory() {
        return history.snapshot();
    }

    public SessionPhase phase() {
        return phase.get();
    }

    public boolean isActive() {
        return phase.get() == SessionPhase.ACTIVE;
    }

    /**
     * Moves the session out of ACTIVE.
     *
     * @return {@code true} if this call performed the transition; {@code false} if the
     *         session had already ended, in which case the caller must not notify
     */
    boolean terminate(SessionPhase terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal phase: " + terminal);
        }
        return phase.compareAndSet(SessionPhase.ACTIVE, terminal);
    }

    SessionTask deliveryTask() {
        return deliveryTask;
    }

    SessionTask monitorTask() {
        return monitorTask;
    }

    void attachDeliveryTask(SessionTask delivery) {
        this.deliveryTask = delivery;
    }

    void attachMonitorTask(SessionTask monitor) {
        this.monitorTask = monitor;
    }

    @Override
    public String toString() {
        return "SessionState[user=" + userId + ", phase=" + phase.get()
                + ", deliveries=" + deliveryCount.get() + ']';
    }
}
