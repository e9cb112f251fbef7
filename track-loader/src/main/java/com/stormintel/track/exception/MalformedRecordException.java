package com.stormintel.track.exception;

/**
 * A source line has the wrong shape: bad field count, an unparsable number,
 * an unknown hemisphere letter, or a storm block that does not add up.
 */
public class MalformedRecordException extends BestTrackException {

    private final int lineNumber;

    public MalformedRecordException(int lineNumber, String message) {
        super(format(lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(int lineNumber, String message, Throwable cause) {
        super(format(lineNumber, message), cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based source line, or 0 when the problem is not tied to one line */
    public int getLineNumber() {
        return lineNumber;
    }

    private static String format(int lineNumber, String message) {
        return lineNumber > 0 ? "line " + lineNumber + ": " + message : message;
    }
}
