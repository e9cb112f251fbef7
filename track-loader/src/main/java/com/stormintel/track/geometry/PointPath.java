package com.stormintel.track.geometry;

import org.locationtech.jts.geom.Point;

import java.util.List;

public record PointPath(TrackVertex vertex) implements StormPath {

    @Override
    public List<TrackVertex> vertices() {
        return List.of(vertex);
    }

    @Override
    public Point geometry() {
        return Geometries.point(vertex.longitude(), vertex.latitude());
    }

    @Override
    public String toWkt() {
        return "POINT(" + vertex.token() + ")";
    }
}
