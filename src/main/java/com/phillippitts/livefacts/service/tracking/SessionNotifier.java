package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.service.delivery.DeliveryChannel;
import com.phillippitts.livefacts.service.delivery.FactMessageFormatter;
import com.phillippitts.livefacts.service.delivery.NotificationKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/**
 * Ends sessions and sends lifecycle notifications.
 *
 * <p>The delivery loop and the health monitor may both detect the end of a session at the
 * same moment. {@link #end} lets exactly one of them win the phase transition, and only the
 * winner notifies the destination.
 */
@Component
public class SessionNotifier {

    private static final Logger LOG = LogManager.getLogger(SessionNotifier.class);

    private final DeliveryChannel channel;
    private final FactMessageFormatter formatter;

    public SessionNotifier(DeliveryChannel channel, FactMessageFormatter formatter) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    /**
     * Moves the session to {@code terminal} and, for EXPIRED and SILENT, notifies its destination.
     *
     * @return {@code true} if this call ended the session
     */
    public boolean end(SessionState state, SessionPhase terminal) {
        if (!state.terminate(terminal)) {
            return false;
        }
        LOG.info("Session for user {} ended: {} after {} deliveries",
                state.userId(), terminal, state.deliveryCount());
        switch (terminal) {
            case EXPIRED -> notify(state.destinationId(), NotificationKind.EXPIRED, state.locale());
            case SILENT -> notify(state.destinationId(), NotificationKind.MANUAL_STOP, state.locale());
            default -> {
                // explicit stops are confirmed by the caller; failures are not user-visible
            }
        }
        return true;
    }

    /**
     * Sends a notification, logging and swallowing channel failures.
     *
     * @return {@code true} if the channel accepted the notification
     */
    public boolean notify(String destinationId, NotificationKind kind, Locale locale, Object... args) {
        try {
            channel.notify(destinationId, kind, formatter.notification(kind, locale, args));
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Failed to send {} notification to {}: {}", kind, destinationId, e.toString());
            return false;
        }
    }
}
