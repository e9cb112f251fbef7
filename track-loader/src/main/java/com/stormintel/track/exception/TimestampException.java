package com.stormintel.track.exception;

public class TimestampException extends BestTrackException {

    public TimestampException(String message, Throwable cause) {
        super(message, cause);
    }
}
