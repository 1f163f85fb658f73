package com.phillippitts.livefacts.service;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.service.delivery.NotificationKind;
import com.phillippitts.livefacts.service.tracking.SessionNotifier;
import com.phillippitts.livefacts.service.tracking.SessionRegistry;
import com.phillippitts.livefacts.service.tracking.SessionRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LiveLocationServiceTest {

    private static final Coordinates POSITION = Coordinates.of(48.8566, 2.3522);

    private final SessionRegistry registry = mock(SessionRegistry.class);
    private final SessionNotifier notifier = mock(SessionNotifier.class);
    private final TrackingProperties props = new TrackingProperties();
    private final LiveLocationService service = new LiveLocationService(registry, notifier, props);

    @Test
    void beginTrackingStartsSessionAndConfirms() {
        service.beginTracking("alice", "chat-alice", POSITION, 3600, 10, Locale.FRENCH);

        ArgumentCaptor<SessionRequest> request = ArgumentCaptor.forClass(SessionRequest.class);
        verify(registry).start(request.capture());
        assertThat(request.getValue().trackingDuration()).isEqualTo(Duration.ofHours(1));
        assertThat(request.getValue().deliveryInterval()).isEqualTo(Duration.ofMinutes(10));
        assertThat(request.getValue().locale()).isEqualTo(Locale.FRENCH);
        assertThat(request.getValue().immediateFirstDelivery()).isTrue();
        verify(notifier).notify("chat-alice", NotificationKind.ACTIVATED, Locale.FRENCH, "60", "10");
    }

    @Test
    void activationIsConfirmedBeforeSessionStarts() {
        service.beginTracking("alice", "chat-alice", POSITION, 3600, 10, Locale.ENGLISH);

        InOrder order = inOrder(notifier, registry);
        order.verify(notifier).notify("chat-alice", NotificationKind.ACTIVATED, Locale.ENGLISH, "60", "10");
        order.verify(registry).start(any(SessionRequest.class));
    }

    @Test
    void beginTrackingUsesConfiguredDefaults() {
        props.setDefaultLocale("ru");
        props.setImmediateFirstDelivery(false);

        service.beginTracking("alice", "chat-alice", POSITION, 900, 5, null);

        ArgumentCaptor<SessionRequest> request = ArgumentCaptor.forClass(SessionRequest.class);
        verify(registry).start(request.capture());
        assertThat(request.getValue().locale()).isEqualTo(Locale.forLanguageTag("ru"));
        assertThat(request.getValue().immediateFirstDelivery()).isFalse();
    }

    @Test
    void livePositionIsForwarded() {
        service.onLivePosition("alice", POSITION);

        verify(registry).updatePosition("alice", POSITION);
    }

    @Test
    void staticLocationFromTrackedUserStopsSession() {
        when(registry.stop("alice")).thenReturn(true);

        boolean stopped = service.onStaticLocation("alice", "chat-alice", Locale.ENGLISH);

        assertThat(stopped).isTrue();
        verify(notifier).notify("chat-alice", NotificationKind.STOPPED, Locale.ENGLISH);
    }

    @Test
    void staticLocationFromUntrackedUserIsLeftToCaller() {
        when(registry.stop("bob")).thenReturn(false);

        boolean stopped = service.onStaticLocation("bob", "chat-bob", Locale.ENGLISH);

        assertThat(stopped).isFalse();
        verifyNoInteractions(notifier);
    }

    @Test
    void stopIsNotConfirmedWhenSessionAlreadyEndedOnItsOwn() {
        // The monitor ended the session between the user's signal and our stop
        when(registry.stop("alice")).thenReturn(false);

        boolean stopped = service.stopTracking("alice", "chat-alice", Locale.ENGLISH);

        assertThat(stopped).isFalse();
        verifyNoInteractions(notifier);
    }
}
