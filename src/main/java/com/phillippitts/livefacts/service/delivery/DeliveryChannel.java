package com.phillippitts.livefacts.service.delivery;

import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.exception.DeliveryException;

/**
 * Boundary to the messaging transport that reaches a user's destination.
 *
 * <p>All methods are best-effort. Implementations report failures with
 * {@link DeliveryException}; callers in this application never let such a failure end a
 * session.
 */
public interface DeliveryChannel {

    /**
     * Sends a formatted (Markdown) text message.
     *
     * @throws DeliveryException if the message could not be sent
     */
    void deliver(String destinationId, String text);

    /**
     * Sends a navigable venue pin for a described place.
     *
     * @throws DeliveryException if the venue could not be sent
     */
    void deliverVenue(String destinationId, String title, String address, Coordinates coordinates);

    /**
     * Sends a lifecycle notification.
     *
     * @param kind what happened, for transports that route or style notifications differently
     * @param text localized notification text
     * @throws DeliveryException if the notification could not be sent
     */
    void notify(String destinationId, NotificationKind kind, String text);
}
