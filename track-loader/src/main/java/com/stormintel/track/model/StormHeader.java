package com.stormintel.track.model;

import lombok.Builder;
import lombok.Value;

/**
 * Storm header line as extracted, e.g. {@code AL092021,                IDA,     40,}
 */
@Value
@Builder
public class StormHeader {

    /** {@code <basin:2><number:2><year:4>}, e.g. AL092021 */
    String eventId;
    String basin;
    /** Only kept for diagnostics, not part of the output */
    String stormNumber;
    String year;
    String name;

    /** Number of observation rows that must follow before the next header */
    int declaredPointCount;

    int lineNumber;
}
