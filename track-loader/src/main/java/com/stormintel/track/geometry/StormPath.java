package com.stormintel.track.geometry;

import org.locationtech.jts.geom.Geometry;

import java.util.List;

/**
 * Track of a storm: a {@link PointPath} for a single observation, a {@link LinePath}
 * through every observation otherwise.
 */
public interface StormPath {

    /** Vertices in observation order */
    List<TrackVertex> vertices();

    Geometry geometry();

    /** WKT with four values per vertex, e.g. {@code LINESTRING(-94.8 28.0 80 NULL, ...)} */
    String toWkt();

    static StormPath of(List<TrackVertex> vertices) {
        if (vertices.isEmpty()) {
            throw new IllegalArgumentException("A storm path needs at least one vertex");
        }
        return vertices.size() == 1
                ? new PointPath(vertices.get(0))
                : new LinePath(vertices);
    }
}
