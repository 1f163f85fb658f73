package com.phillippitts.livefacts.service.delivery;

/**
 * Lifecycle notifications sent to a tracking destination.
 */
public enum NotificationKind {
    /** Tracking started; sent by the caller that began the session. */
    ACTIVATED("notification.activated"),
    /** Tracking duration elapsed. */
    EXPIRED("notification.expired"),
    /** Position updates stopped arriving; the user most likely stopped sharing. */
    MANUAL_STOP("notification.manual-stop"),
    /** Confirmation of an explicit stop request. */
    STOPPED("notification.stopped");

    private final String messageKey;

    NotificationKind(String messageKey) {
        this.messageKey = messageKey;
    }

    public String messageKey() {
        return messageKey;
    }
}
