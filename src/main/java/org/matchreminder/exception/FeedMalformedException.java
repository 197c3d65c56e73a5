package org.matchreminder.exception;

/**
 * The feed answered, but the payload (or a timestamp inside it) could not be parsed.
 */
public class FeedMalformedException extends FeedException {

    public FeedMalformedException(String message) {
        super(message);
    }

    public FeedMalformedException(String message, Throwable cause) {
        super(message, cause);
    }
}
