package com.stormintel.track.model;

import com.stormintel.track.geometry.StormPath;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One storm of the storms table.
 */
@Value
@Builder
public class Storm {

    String eventId;
    String basin;
    String name;

    /** Time of the first observation in source order */
    Instant startTime;

    StormPath path;
}
