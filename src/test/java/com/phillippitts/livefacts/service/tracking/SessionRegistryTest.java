package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.exception.SessionStartException;
import com.phillippitts.livefacts.service.tracking.event.SessionEndedEvent;
import com.phillippitts.livefacts.service.tracking.event.SessionStartedEvent;
import com.phillippitts.livefacts.testutil.ScriptedContentGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.livefacts.service.tracking.TrackingFixture.LOUVRE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class SessionRegistryTest {

    private static final Duration LONG = Duration.ofMinutes(5);
    private static final Duration HOURLY = Duration.ofHours(1);

    private TrackingFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void keepsOneSessionPerUser() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());

        SessionState first = fixture.start("alice", LONG, HOURLY);
        SessionState second = fixture.start("alice", LONG, Duration.ofMinutes(10));

        assertThat(fixture.registry.activeCount()).isEqualTo(1);
        assertThat(fixture.registry.find("alice")).containsSame(second);
        assertThat(first.phase()).isEqualTo(SessionPhase.STOPPED_EXPLICITLY);
        assertThat(first.deliveryTask().isSettled()).isTrue();
        assertThat(first.monitorTask().isSettled()).isTrue();
        assertThat(second.isActive()).isTrue();
    }

    @Test
    void restartAppliesNewParameters() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());

        fixture.start("alice", LONG, HOURLY);
        fixture.start("alice", Duration.ofMinutes(30), Duration.ofMinutes(10));

        SessionState current = fixture.registry.find("alice").orElseThrow();
        assertThat(current.trackingDuration()).isEqualTo(Duration.ofMinutes(30));
        assertThat(current.deliveryInterval()).isEqualTo(Duration.ofMinutes(10));

        SessionStartedEvent restarted = fixture.publisher.eventsOf(SessionStartedEvent.class).get(1);
        assertThat(restarted.replaced()).isTrue();
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class))
                .singleElement()
                .extracting(SessionEndedEvent::reason)
                .isEqualTo(SessionPhase.STOPPED_EXPLICITLY);
    }

    @Test
    void startWithClientUnitsConvertsSecondsAndMinutes() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());

        fixture.registry.start("bob", "chat-bob", TrackingFixture.EIFFEL_TOWER, 3600, 15);

        SessionState state = fixture.registry.find("bob").orElseThrow();
        assertThat(state.trackingDuration()).isEqualTo(Duration.ofHours(1));
        assertThat(state.deliveryInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(state.deliveryCount()).isZero();
        assertThat(state.contentHistory()).isEmpty();
        assertThat(state.lastUpdateTime()).isEqualTo(state.sessionStart());
    }

    @Test
    void stopEndsDeliveriesImmediately() throws InterruptedException {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        SessionState state = fixture.start("alice", LONG, Duration.ofMillis(50));

        await().atMost(Duration.ofSeconds(5)).until(() -> fixture.channel.facts().size() >= 1);
        fixture.registry.stop("alice");

        assertThat(fixture.registry.isTracking("alice")).isFalse();
        assertThat(state.phase()).isEqualTo(SessionPhase.STOPPED_EXPLICITLY);
        int delivered = fixture.channel.facts().size();

        Thread.sleep(300);
        assertThat(fixture.channel.facts()).hasSize(delivered);
        // An explicit stop is confirmed by the caller, not by the registry
        assertThat(fixture.channel.notifications()).isEmpty();
    }

    @Test
    void stopPublishesExactlyOneEndedEvent() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        fixture.start("alice", LONG, HOURLY);

        assertThat(fixture.registry.stop("alice")).isTrue();
        assertThat(fixture.registry.stop("alice")).isFalse();

        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class)).hasSize(1);
    }

    @Test
    void stopAfterSessionEndedOnItsOwnReportsNothingStopped() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        SessionState state = fixture.start("alice", Duration.ofMillis(100), HOURLY);

        await().atMost(Duration.ofSeconds(5))
                .until(() -> fixture.publisher.eventsOf(SessionEndedEvent.class).size() == 1);

        assertThat(fixture.registry.stop("alice")).isFalse();
        assertThat(state.phase()).isEqualTo(SessionPhase.EXPIRED);
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class)).hasSize(1);
    }

    @Test
    void replacingSessionWhoseTasksNeverRanReportsReplacement() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        SessionRegistry registry = new SessionRegistry(fixture.tasks, new NeverRunningExecutor(),
                fixture.props, fixture.publisher);

        SessionState first = registry.start(TrackingFixture.request("alice", LONG, HOURLY));
        SessionState second = registry.start(TrackingFixture.request("alice", Duration.ofMinutes(30), Duration.ofMinutes(10)));

        assertThat(fixture.publisher.eventsOf(SessionStartedEvent.class))
                .extracting(SessionStartedEvent::replaced)
                .containsExactly(false, true);
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class))
                .singleElement()
                .extracting(SessionEndedEvent::reason)
                .isEqualTo(SessionPhase.STOPPED_EXPLICITLY);
        assertThat(first.deliveryTask().isSettled()).isTrue();
        assertThat(registry.find("alice")).containsSame(second);
        assertThat(registry.activeCount()).isEqualTo(1);

        assertThat(registry.stop("alice")).isTrue();
        assertThat(registry.activeCount()).isZero();
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class)).hasSize(2);
    }

    @Test
    void stopOfUntrackedUserIsNoop() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());

        fixture.registry.stop("nobody");

        assertThat(fixture.registry.activeCount()).isZero();
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class)).isEmpty();
    }

    @Test
    void positionUpdateReplacesCoordinatesAndTime() throws InterruptedException {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        SessionState state = fixture.start("alice", LONG, HOURLY);
        Thread.sleep(5);

        fixture.registry.updatePosition("alice", LOUVRE);

        assertThat(state.position()).isEqualTo(LOUVRE);
        assertThat(state.lastUpdateTime()).isAfter(state.sessionStart());
    }

    @Test
    void positionUpdateForUntrackedUserIsDropped() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());

        fixture.registry.updatePosition("nobody", LOUVRE);

        assertThat(fixture.registry.isTracking("nobody")).isFalse();
        assertThat(fixture.registry.activeCount()).isZero();
    }

    @Test
    void isolatesUsers() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        fixture.start("alice", LONG, HOURLY);
        fixture.start("bob", LONG, HOURLY);

        fixture.registry.stop("alice");
        fixture.registry.updatePosition("bob", LOUVRE);

        assertThat(fixture.registry.isTracking("alice")).isFalse();
        assertThat(fixture.registry.isTracking("bob")).isTrue();
        assertThat(fixture.registry.find("bob").orElseThrow().position()).isEqualTo(LOUVRE);
    }

    @Test
    void stopAllEndsEverySession() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        SessionState alice = fixture.start("alice", LONG, HOURLY);
        SessionState bob = fixture.start("bob", LONG, HOURLY);

        fixture.registry.stopAll();

        assertThat(fixture.registry.activeCount()).isZero();
        assertThat(alice.deliveryTask().isSettled()).isTrue();
        assertThat(bob.deliveryTask().isSettled()).isTrue();
    }

    @Test
    void saturatedPoolFailsStartWithoutRegistering() {
        // Two threads: room for exactly one session
        fixture = new TrackingFixture(TrackingFixture.fastProperties(), ScriptedContentGenerator.answering(), 2);
        fixture.start("alice", LONG, HOURLY);

        assertThatThrownBy(() -> fixture.start("bob", LONG, HOURLY))
                .isInstanceOf(SessionStartException.class)
                .satisfies(e -> assertThat(((SessionStartException) e).getUserId()).isEqualTo("bob"));

        assertThat(fixture.registry.isTracking("bob")).isFalse();
        assertThat(fixture.registry.isTracking("alice")).isTrue();
        assertThat(fixture.registry.activeCount()).isEqualTo(1);
    }

    @Test
    void monitorSpawnFailureCancelsDeliveryLoop() {
        fixture = new TrackingFixture(ScriptedContentGenerator.answering());
        RejectingExecutor executor = new RejectingExecutor(1);
        SessionRegistry registry = new SessionRegistry(fixture.tasks, executor, fixture.props, fixture.publisher);
        try {
            assertThatThrownBy(() -> registry.start(TrackingFixture.request("alice", LONG, Duration.ofMillis(50))))
                    .isInstanceOf(SessionStartException.class)
                    .hasCauseInstanceOf(TaskRejectedException.class);

            assertThat(registry.isTracking("alice")).isFalse();
            assertThat(fixture.publisher.eventsOf(SessionStartedEvent.class)).isEmpty();
            assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class)).isEmpty();
            assertThat(fixture.channel.facts()).isEmpty();
        } finally {
            executor.shutdown();
        }
    }

    /** Accepts the first {@code accepted} submissions, then rejects. */
    static class RejectingExecutor extends ThreadPoolTaskExecutor {
        private final AtomicInteger left;

        RejectingExecutor(int accepted) {
            this.left = new AtomicInteger(accepted);
            setCorePoolSize(2);
            setQueueCapacity(0);
            initialize();
        }

        @Override
        public Future<?> submit(Runnable task) {
            if (left.getAndDecrement() <= 0) {
                throw new TaskRejectedException("pool full");
            }
            return super.submit(task);
        }
    }

    /** Accepts every submission and never runs it. */
    static class NeverRunningExecutor extends SimpleAsyncTaskExecutor {
        @Override
        public Future<?> submit(Runnable task) {
            return new FutureTask<>(task, null);
        }
    }
}
