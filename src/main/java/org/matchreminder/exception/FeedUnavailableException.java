package org.matchreminder.exception;

/**
 * The feed answered with a non-success status, or could not be reached at all.
 */
public class FeedUnavailableException extends FeedException {

    private final int statusCode;

    public FeedUnavailableException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FeedUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    /**
     * HTTP status returned by the feed, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
