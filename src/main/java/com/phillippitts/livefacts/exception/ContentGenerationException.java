package com.phillippitts.livefacts.exception;

/**
 * Thrown when content generation for a position fails or times out.
 * Delivery loops recover from this locally by sending a placeholder message.
 */
public class ContentGenerationException extends LiveFactsException {

    private final String reason;

    public ContentGenerationException(String message) {
        super(message);
        this.reason = "error";
    }

    public ContentGenerationException(String message, String reason) {
        super(message + " (reason: " + reason + ")");
        this.reason = reason;
    }

    public ContentGenerationException(String message, String reason, Throwable cause) {
        super(message + " (reason: " + reason + ")", cause);
        this.reason = reason;
    }

    /**
     * Short machine-friendly reason (timeout, rejected, error) used as a metric tag.
     */
    public String getReason() {
        return reason;
    }
}
