package com.stormintel.track.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Observation line as extracted: positions are signed, numbers parsed, everything
 * else still in its source spelling.
 */
@Value
@Builder
public class RawObservation {

    public static final int WIND_RADII_COUNT = 12;

    /** Owning storm, i.e. the nearest preceding header */
    String eventId;
    int lineNumber;

    // ── Time (source spelling) ──────────────────────────────────────────────
    String year;
    String month;
    String day;
    String hour;
    String minute;

    // ── Codes (source spelling) ─────────────────────────────────────────────
    String identifierCode;
    String statusCode;

    // ── Position ────────────────────────────────────────────────────────────
    double latitude;
    double longitude;

    // ── Intensity, sentinels still in place ─────────────────────────────────
    int maxWind;
    int minPressure;

    /** 34, 50 and 64 kt thresholds, each NE, SE, SW, NW; unmodifiable */
    List<Integer> windRadii;
}
