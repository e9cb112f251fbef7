package com.stormintel.track.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.List;

/**
 * Shared WGS84 geometry factory and the WKT spelling used in the bulk-load files.
 */
public final class Geometries {

    public static final int WGS84_SRID = 4326;

    /** Marker written in place of a missing measure inside a path token */
    public static final String NULL_TOKEN = "NULL";

    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private Geometries() {
    }

    public static Point point(double longitude, double latitude) {
        return FACTORY.createPoint(new Coordinate(longitude, latitude));
    }

    public static LineString line(List<Coordinate> coordinates) {
        return FACTORY.createLineString(coordinates.toArray(new Coordinate[0]));
    }

    /** e.g. {@code POINT(-94.8 28.0)} */
    public static String pointWkt(double longitude, double latitude) {
        return "POINT(" + longitude + " " + latitude + ")";
    }

    static String measure(Integer value) {
        return value == null ? NULL_TOKEN : value.toString();
    }
}
