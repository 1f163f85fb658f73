package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.service.delivery.NotificationKind;
import com.phillippitts.livefacts.service.tracking.event.SessionEndedEvent;
import com.phillippitts.livefacts.testutil.ScriptedContentGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.phillippitts.livefacts.service.tracking.TrackingFixture.LOUVRE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class HealthMonitorTest {

    private TrackingFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private static TrackingProperties silenceAfter(Duration threshold) {
        TrackingProperties props = TrackingFixture.fastProperties();
        props.setSilenceThreshold(threshold);
        props.setHealthPollInterval(Duration.ofMillis(20));
        return props;
    }

    @Test
    void detectsSilenceLongBeforeNextDelivery() throws InterruptedException {
        fixture = new TrackingFixture(silenceAfter(Duration.ofMillis(150)), ScriptedContentGenerator.answering());
        SessionState state = fixture.start("alice", Duration.ofHours(2), Duration.ofHours(1));

        await().atMost(Duration.ofSeconds(2)).until(() -> fixture.channel.count(NotificationKind.MANUAL_STOP) == 1);
        await().atMost(Duration.ofSeconds(2)).until(() -> !fixture.registry.isTracking("alice"));
        Thread.sleep(100);

        assertThat(state.phase()).isEqualTo(SessionPhase.SILENT);
        assertThat(fixture.channel.notificationKinds()).containsExactly(NotificationKind.MANUAL_STOP);
        assertThat(fixture.channel.notifications().get(0).destinationId()).isEqualTo("chat-alice");
        assertThat(fixture.channel.facts()).isEmpty();
        assertThat(state.deliveryTask().isSettled()).isTrue();
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class))
                .singleElement()
                .extracting(SessionEndedEvent::reason)
                .isEqualTo(SessionPhase.SILENT);
    }

    @Test
    void positionUpdatesKeepSessionAlive() throws InterruptedException {
        fixture = new TrackingFixture(silenceAfter(Duration.ofMillis(200)), ScriptedContentGenerator.answering());
        fixture.start("alice", Duration.ofHours(2), Duration.ofHours(1));

        for (int i = 0; i < 10; i++) {
            Thread.sleep(50);
            fixture.registry.updatePosition("alice", LOUVRE);
        }

        assertThat(fixture.registry.isTracking("alice")).isTrue();
        assertThat(fixture.channel.notifications()).isEmpty();
    }

    @Test
    void silenceAndExpiryTogetherProduceOneNotification() throws InterruptedException {
        // Delivery loop and monitor race to end the session
        fixture = new TrackingFixture(silenceAfter(Duration.ofMillis(100)), ScriptedContentGenerator.answering());
        fixture.start("alice", Duration.ofMillis(150), Duration.ofMillis(30));

        await().atMost(Duration.ofSeconds(3)).until(() -> !fixture.registry.isTracking("alice"));
        Thread.sleep(100);

        assertThat(fixture.channel.notifications()).hasSize(1);
        assertThat(fixture.channel.notificationKinds())
                .containsAnyOf(NotificationKind.EXPIRED, NotificationKind.MANUAL_STOP);
        assertThat(fixture.publisher.eventsOf(SessionEndedEvent.class)).hasSize(1);
    }

    @Test
    void exitsWithoutNotifyingWhenSessionStopped() {
        fixture = new TrackingFixture(silenceAfter(Duration.ofMillis(100)), ScriptedContentGenerator.answering());
        SessionState state = fixture.start("alice", Duration.ofHours(2), Duration.ofHours(1));

        fixture.registry.stop("alice");

        assertThat(state.monitorTask().isSettled()).isTrue();
        assertThat(fixture.channel.notifications()).isEmpty();
    }
}
