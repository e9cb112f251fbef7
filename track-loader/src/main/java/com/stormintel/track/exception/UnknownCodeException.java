package com.stormintel.track.exception;

/**
 * A record identifier or status code that is neither in its code table
 * nor one of the table's documented "missing" codes.
 */
public class UnknownCodeException extends BestTrackException {

    private final String table;
    private final String code;

    public UnknownCodeException(String table, String code) {
        super(String.format("Unknown %s code '%s'", table, code));
        this.table = table;
        this.code = code;
    }

    public UnknownCodeException(String message, UnknownCodeException cause) {
        super(message, cause);
        this.table = cause.table;
        this.code = cause.code;
    }

    public String getTable() {
        return table;
    }

    public String getCode() {
        return code;
    }
}
