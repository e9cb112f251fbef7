package com.stormintel.track.geometry;

import org.locationtech.jts.geom.Coordinate;

/**
 * One vertex of a storm path. Wind and pressure ride along so the WKT keeps one
 * token group per observation, even though the geometry only uses the position.
 */
public record TrackVertex(double longitude, double latitude, Integer maxWindKnots, Integer minPressureMb) {

    /** {@code "longitude latitude wind pressure"}, missing measures as {@code NULL} */
    public String token() {
        return longitude + " " + latitude + " "
                + Geometries.measure(maxWindKnots) + " "
                + Geometries.measure(minPressureMb);
    }

    public Coordinate coordinate() {
        return new Coordinate(longitude, latitude);
    }
}
