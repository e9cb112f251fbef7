package com.stormintel.track.model;

import com.stormintel.track.codes.RecordIdentifier;
import com.stormintel.track.codes.StormStatus;
import lombok.Builder;
import lombok.Value;
import org.locationtech.jts.geom.Point;

import java.time.Instant;

/**
 * Normalised best-track observation, one row of the observations table.
 * Nullable fields are the ones the source marks as not recorded.
 */
@Value
@Builder
public class Observation {

    String eventId;
    Instant pointTime;

    /** Null when the source column is blank */
    RecordIdentifier identifier;

    /** Null for blank or invalid Pacific codes */
    StormStatus status;

    double latitude;
    double longitude;

    /** (longitude, latitude), SRID 4326 */
    Point location;

    Integer maxWindKnots;
    Integer minPressureMb;

    WindRadii windRadii;
}
