package com.phillippitts.livefacts.exception;

/**
 * Thrown when a tracking session cannot be started because one of its background
 * tasks could not be spawned (typically the session pool rejected the submission).
 *
 * <p>When this is thrown no partial registration is left behind: the registry does not
 * contain an entry for the user and any task that did start has been cancelled.
 */
public class SessionStartException extends LiveFactsException {

    private final String userId;

    public SessionStartException(String userId, Throwable cause) {
        super("Failed to start tracking session (user: " + userId + ")", cause);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
