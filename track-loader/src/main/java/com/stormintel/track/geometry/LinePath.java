package com.stormintel.track.geometry;

import org.locationtech.jts.geom.LineString;

import java.util.List;
import java.util.stream.Collectors;

public record LinePath(List<TrackVertex> vertices) implements StormPath {

    public LinePath {
        if (vertices.size() < 2) {
            throw new IllegalArgumentException("A line path needs at least two vertices, got " + vertices.size());
        }
        vertices = List.copyOf(vertices);
    }

    @Override
    public LineString geometry() {
        return Geometries.line(vertices.stream().map(TrackVertex::coordinate).toList());
    }

    @Override
    public String toWkt() {
        return vertices.stream()
                .map(TrackVertex::token)
                .collect(Collectors.joining(",", "LINESTRING(", ")"));
    }
}
