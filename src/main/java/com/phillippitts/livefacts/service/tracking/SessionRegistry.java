package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.exception.SessionStartException;
import com.phillippitts.livefacts.service.tracking.event.SessionEndedEvent;
import com.phillippitts.livefacts.service.tracking.event.SessionStartedEvent;
import com.phillippitts.livefacts.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for which users are currently tracked.
 *
 * <p>Each entry owns a {@link SessionState} and the handles of its two background tasks,
 * a {@link DeliveryLoop} and a {@link HealthMonitor}, both running on the
 * {@code sessionExecutor} pool.
 *
 * <p><b>Thread Safety:</b> every structural change (insert, replace, remove) happens under
 * one {@link ReentrantLock}. The map itself is concurrent so that {@link #isTracking} and
 * {@link #activeCount} never wait for a slow stop. Removals are identity-checked: a task of
 * an old session never removes a newer session of the same user.
 *
 * <p><b>Stopping:</b> {@link #stop} and a replacing {@link #start} cancel both tasks and wait
 * up to {@code tracking.stop-timeout} for each to settle while holding the lock, so a new
 * session never begins while the old one can still deliver. Task cleanup that needs the lock
 * runs only after the task has settled, which keeps that wait deadlock-free.
 */
@Service
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final SessionTaskFactory tasks;
    private final AsyncTaskExecutor executor;
    private final TrackingProperties props;
    private final ApplicationEventPublisher publisher;

    public SessionRegistry(SessionTaskFactory tasks,
                           @Qualifier("sessionExecutor") AsyncTaskExecutor executor,
                           TrackingProperties props,
                           ApplicationEventPublisher publisher) {
        this.tasks = Objects.requireNonNull(tasks, "tasks");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Starts tracking a user with the units live-location clients report.
     *
     * @see #start(SessionRequest)
     */
    public void start(String userId,
                      String destinationId,
                      Coordinates initialPosition,
                      long trackingDurationSeconds,
                      int deliveryIntervalMinutes) {
        start(SessionRequest.of(userId, destinationId, initialPosition, trackingDurationSeconds, deliveryIntervalMinutes));
    }

    /**
     * Starts tracking a user, replacing any session the user already has.
     *
     * <p>The old session is fully stopped (both tasks settled, entry removed) before the new
     * session's tasks are spawned.
     *
     * @param request session parameters
     * @return the new session's state
     * @throws SessionStartException if a background task could not be spawned; nothing is
     *                               registered in that case
     */
    public SessionState start(SessionRequest request) {
        Objects.requireNonNull(request, "request");
        String userId = request.userId();

        SessionState state;
        Optional<SessionEndedEvent> ended;
        lock.lock();
        try {
            ended = stopLocked(userId);

            state = new SessionState(request, Instant.now(), props.getHistoryLimit());
            spawnTasks(state);
            sessions.put(userId, state);
        } finally {
            lock.unlock();
        }

        boolean replaced = ended.isPresent();
        ended.ifPresent(publisher::publishEvent);
        LOG.info("Started tracking user {} at {} for {}, deliveries every {}{}",
                userId, LogSanitizer.coarse(request.initialPosition()), request.trackingDuration(),
                request.deliveryInterval(), replaced ? " (replaced previous session)" : "");
        publisher.publishEvent(new SessionStartedEvent(userId, request.destinationId(),
                request.trackingDuration(), request.deliveryInterval(), replaced, state.sessionStart()));
        return state;
    }

    /** Spawns both tasks or none. Called with the lock held. */
    private void spawnTasks(SessionState state) {
        SessionTask delivery = null;
        try {
            delivery = SessionTask.spawn("delivery-" + state.userId(), executor,
                    tasks.deliveryLoop(state), () -> release(state));
            state.attachDeliveryTask(delivery);
            SessionTask monitor = SessionTask.spawn("monitor-" + state.userId(), executor,
                    tasks.healthMonitor(state), () -> { });
            state.attachMonitorTask(monitor);
        } catch (RuntimeException spawnFailure) {
            state.terminate(SessionPhase.FAILED);
            if (delivery != null) {
                delivery.cancelAndAwait(props.getStopTimeout());
            }
            LOG.error("Could not spawn session tasks for user {}: {}", state.userId(), spawnFailure.toString());
            throw new SessionStartException(state.userId(), spawnFailure);
        }
    }

    /**
     * Records a new position for a tracked user. Updates for untracked users are dropped.
     */
    public void updatePosition(String userId, Coordinates position) {
        Objects.requireNonNull(position, "position");
        lock.lock();
        try {
            SessionState state = sessions.get(userId);
            if (state == null) {
                LOG.debug("Dropping position update for untracked user {}", userId);
                return;
            }
            state.updatePosition(position, Instant.now());
        } finally {
            lock.unlock();
        }
        LOG.debug("Updated position for user {}: {}", userId, LogSanitizer.coarse(position));
    }

    /**
     * Stops tracking a user. No notification is sent; the caller confirms the stop if it
     * wants to. No-op for untracked users.
     *
     * @return {@code true} if this call ended a session, {@code false} if the user had none
     *         (or it had already ended on its own)
     */
    public boolean stop(String userId) {
        Optional<SessionEndedEvent> ended;
        lock.lock();
        try {
            ended = stopLocked(userId);
        } finally {
            lock.unlock();
        }
        ended.ifPresent(publisher::publishEvent);
        // A session that expired or went silent just before this call was not ended by it
        return ended.filter(e -> e.reason() == SessionPhase.STOPPED_EXPLICITLY).isPresent();
    }

    private Optional<SessionEndedEvent> stopLocked(String userId) {
        SessionState state = sessions.get(userId);
        if (state == null) {
            return Optional.empty();
        }
        state.terminate(SessionPhase.STOPPED_EXPLICITLY);
        Duration timeout = props.getStopTimeout();
        settle(state.deliveryTask(), timeout);
        settle(state.monitorTask(), timeout);
        // Task cleanup defers to this thread while it holds the lock, so the entry is still ours
        sessions.remove(userId, state);
        LOG.info("Stopped tracking user {} ({}) after {} deliveries", userId, state.phase(), state.deliveryCount());
        return Optional.of(endedEvent(state));
    }

    private void settle(SessionTask task, Duration timeout) {
        if (task == null) {
            return;
        }
        if (!task.cancelAndAwait(timeout)) {
            LOG.warn("{} did not settle within {} ms; removing session anyway", task.name(), timeout.toMillis());
        }
    }

    /**
     * Cleanup run once a delivery loop has settled: removes the entry if it still belongs to
     * {@code state} and cancels the sibling monitor. Idempotent.
     *
     * <p>A loop cancelled before it ever ran settles inline on the thread that is stopping it.
     * That thread already holds the lock and removes the entry itself, so nothing is removed
     * or published here.
     */
    void release(SessionState state) {
        if (state.terminate(SessionPhase.FAILED)) {
            LOG.warn("Delivery loop for user {} exited while session was active", state.userId());
        }
        SessionTask monitor = state.monitorTask();
        if (monitor != null) {
            monitor.cancel();
        }
        if (lock.isHeldByCurrentThread()) {
            return;
        }

        boolean removed;
        lock.lock();
        try {
            removed = sessions.remove(state.userId(), state);
        } finally {
            lock.unlock();
        }
        if (removed) {
            LOG.info("Removed session of user {} ({})", state.userId(), state.phase());
            publisher.publishEvent(endedEvent(state));
        }
    }

    private static SessionEndedEvent endedEvent(SessionState state) {
        return new SessionEndedEvent(state.userId(), state.phase(), state.deliveryCount(), Instant.now());
    }

    public boolean isTracking(String userId) {
        return userId != null && sessions.containsKey(userId);
    }

    public int activeCount() {
        return sessions.size();
    }

    /** Current session of a user, for diagnostics and tests. */
    public Optional<SessionState> find(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    /**
     * Stops every session; used on shutdown.
     */
    @PreDestroy
    public void stopAll() {
        List<String> users = new ArrayList<>(sessions.keySet());
        if (!users.isEmpty()) {
            LOG.info("Stopping {} tracking sessions", users.size());
        }
        users.forEach(this::stop);
    }

    @Scheduled(fixedRate = 60_000)
    void logSessionSummary() {
        if (sessions.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder("Active sessions: ");
        sessions.forEach((user, st) -> sb.append(user).append("(#").append(st.deliveryCount()).append(") "));
        LOG.info(sb.toString().trim());
    }
}
