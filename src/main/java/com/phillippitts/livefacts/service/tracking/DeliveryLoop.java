package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.domain.ContentResult;
import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.domain.ParsedContent;
import com.phillippitts.livefacts.exception.ContentGenerationException;
import com.phillippitts.livefacts.service.content.ContentParser;
import com.phillippitts.livefacts.service.content.GenerationService;
import com.phillippitts.livefacts.service.delivery.DeliveryChannel;
import com.phillippitts.livefacts.service.delivery.FactMessageFormatter;
import com.phillippitts.livefacts.service.tracking.event.DeliveryAttemptedEvent;
import com.phillippitts.livefacts.util.LogSanitizer;
import com.phillippitts.livefacts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.phillippitts.livefacts.service.tracking.event.DeliveryAttemptedEvent.Outcome;

/**
 * Periodic task that delivers generated content for one session at the requested cadence.
 *
 * <p><b>Pacing:</b> the first cycle runs after {@code max(interval - latencyEstimate,
 * minInitialWait)} so that, once generation latency is added, the first message lands about
 * one interval after the start. Each later wait is {@code max(interval - cycleTime,
 * floorSleep)}, which keeps the long-run cadence close to the interval while a very fast
 * cycle can never make messages arrive back to back. Waits never extend past the expiry
 * instant.
 *
 * <p><b>Termination:</b> the loop ends the session itself on expiry or on position silence,
 * and returns quietly when it finds the session already ended by its health monitor or by
 * an explicit stop. Cancellation arrives as an interrupt at a sleep or at the generation
 * wait and is the normal way the loop stops.
 *
 * <p><b>Failures:</b> a failed generation still produces a numbered placeholder message;
 * a failed channel call is logged and the loop carries on.
 */
public final class DeliveryLoop implements Runnable {

    private static final Logger LOG = LogManager.getLogger(DeliveryLoop.class);
    private static final int LOG_PREVIEW_CHARS = 60;

    private final SessionState state;
    private final TrackingProperties props;
    private final GenerationService generation;
    private final ContentParser parser;
    private final FactMessageFormatter formatter;
    private final DeliveryChannel channel;
    private final SessionNotifier notifier;
    private final ApplicationEventPublisher publisher;

    DeliveryLoop(SessionState state,
                 TrackingProperties props,
                 GenerationService generation,
                 ContentParser parser,
                 FactMessageFormatter formatter,
                 DeliveryChannel channel,
                 SessionNotifier notifier,
                 ApplicationEventPublisher publisher) {
        this.state = Objects.requireNonNull(state, "state");
        this.props = Objects.requireNonNull(props, "props");
        this.generation = Objects.requireNonNull(generation, "generation");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void run() {
        ThreadContext.put("userId", state.userId());
        ThreadContext.put("task", "delivery");
        try {
            loop();
        } catch (InterruptedException ie) {
            LOG.debug("Delivery loop cancelled (phase={})", state.phase());
        } catch (RuntimeException unexpected) {
            LOG.error("Delivery loop terminated by unexpected error", unexpected);
        } finally {
            ThreadContext.remove("task");
            ThreadContext.remove("userId");
        }
    }

    private void loop() throws InterruptedException {
        LOG.info("Delivery loop started: interval={}, expires at {}",
                state.deliveryInterval(), state.expiryInstant());

        if (state.immediateFirstDelivery() && state.isActive()) {
            guardedCycle();
        }
        pause(initialWait());

        while (true) {
            if (!state.isActive()) {
                LOG.debug("Session already ended ({}), delivery loop exiting", state.phase());
                return;
            }
            Instant now = Instant.now();
            if (state.isExpiredAt(now)) {
                notifier.end(state, SessionPhase.EXPIRED);
                return;
            }
            if (state.positionFix().isSilentAt(now, props.getSilenceThreshold())) {
                notifier.end(state, SessionPhase.SILENT);
                return;
            }

            long cycleStart = System.nanoTime();
            guardedCycle();
            Duration elapsed = TimeUtils.elapsedSince(cycleStart);
            pause(TimeUtils.remainingOrFloor(state.deliveryInterval(), elapsed, props.getFloorSleep()));
        }
    }

    /** Wait before the first paced cycle. Visible for tests. */
    Duration initialWait() {
        return TimeUtils.remainingOrFloor(state.deliveryInterval(), props.getLatencyEstimate(),
                props.getMinInitialWait());
    }

    private void pause(Duration wait) throws InterruptedException {
        Duration untilExpiry = Duration.between(Instant.now(), state.expiryInstant());
        TimeUtils.sleep(TimeUtils.min(wait, untilExpiry));
    }

    /** One bad cycle must not end the session. */
    private void guardedCycle() throws InterruptedException {
        try {
            cycle();
        } catch (RuntimeException e) {
            LOG.error("Delivery cycle failed", e);
        }
    }

    private void cycle() throws InterruptedException {
        long t0 = System.nanoTime();
        Coordinates position = state.position();
        List<String> exclusions = state.exclusionList(props.getExclusionWindow());

        ContentResult result = null;
        ParsedContent content = null;
        try {
            result = generation.generate(position, exclusions);
            content = parser.parse(result.text(), formatter.nearYou(state.locale()));
        } catch (ContentGenerationException e) {
            LOG.warn("No content for {}: {}", LogSanitizer.coarse(position), e.getMessage());
        }

        // Generation may outlive the session; nothing is delivered after it ended
        if (!state.isActive() || state.isExpiredAt(Instant.now())) {
            LOG.debug("Session ended during generation, discarding cycle");
            return;
        }

        int number = state.nextDeliveryNumber();
        Outcome outcome;
        if (content != null) {
            state.recordContent(content.historyEntry());
            boolean sent = send(formatter.fact(number, content, state.locale()));
            outcome = sent ? Outcome.DELIVERED : Outcome.CHANNEL_FAILED;
            if (sent) {
                LOG.info("Delivered fact #{}: {}", number, LogSanitizer.truncate(content.place(), LOG_PREVIEW_CHARS));
                sendVenue(content.place(), result);
            }
        } else {
            outcome = send(formatter.placeholder(number, state.locale())) ? Outcome.PLACEHOLDER : Outcome.CHANNEL_FAILED;
            LOG.info("Delivered placeholder #{}", number);
        }

        publisher.publishEvent(new DeliveryAttemptedEvent(
                state.userId(), number, outcome, TimeUtils.elapsedSince(t0), Instant.now()));
    }

    private boolean send(String text) {
        try {
            channel.deliver(state.destinationId(), text);
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Delivery to {} failed: {}", state.destinationId(), e.toString());
            return false;
        }
    }

    private void sendVenue(String place, ContentResult result) {
        // The text send may have blocked past a stop
        if (!state.isActive()) {
            return;
        }
        result.companionCoordinates().ifPresent(coordinates -> {
            try {
                channel.deliverVenue(state.destinationId(), place,
                        formatter.venueAddress(place, state.locale()), coordinates);
            } catch (RuntimeException e) {
                LOG.warn("Venue for '{}' not delivered: {}", LogSanitizer.truncate(place, LOG_PREVIEW_CHARS), e.toString());
            }
        });
    }

    SessionState state() {
        return state;
    }
}
