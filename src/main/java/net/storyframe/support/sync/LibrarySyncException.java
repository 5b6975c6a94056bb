package net.storyframe.support.sync;

/**
 * Thrown when an external image library request fails.
 */
public class LibrarySyncException extends RuntimeException {

    public LibrarySyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
