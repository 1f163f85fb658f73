package com.phillippitts.livefacts.exception;

/**
 * Thrown by a {@link com.phillippitts.livefacts.service.delivery.DeliveryChannel} when a
 * message cannot be sent to its destination. Never fatal to a tracking session.
 */
public class DeliveryException extends LiveFactsException {

    private final String destinationId;

    public DeliveryException(String message, String destinationId) {
        super(message + " (destination: " + destinationId + ")");
        this.destinationId = destinationId;
    }

    public DeliveryException(String message, String destinationId, Throwable cause) {
        super(message + " (destination: " + destinationId + ")", cause);
        this.destinationId = destinationId;
    }

    public String getDestinationId() {
        return destinationId;
    }
}
