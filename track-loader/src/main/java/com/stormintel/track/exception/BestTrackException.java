package com.stormintel.track.exception;

/**
 * Base type for every failure that makes a best-track file unusable.
 * None of these are transient: a file that raises one is rejected as a whole.
 */
public abstract class BestTrackException extends RuntimeException {

    protected BestTrackException(String message) {
        super(message);
    }

    protected BestTrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
