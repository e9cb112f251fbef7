package com.stormintel.track.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Maximum extent in nautical miles of the 34, 50 and 64 kt winds per quadrant.
 * A null value means the extent was not recorded.
 */
@Value
@Builder
public class WindRadii {

    public static final int MISSING = -999;

    Integer ne34kt;
    Integer se34kt;
    Integer sw34kt;
    Integer nw34kt;
    Integer ne50kt;
    Integer se50kt;
    Integer sw50kt;
    Integer nw50kt;
    Integer ne64kt;
    Integer se64kt;
    Integer sw64kt;
    Integer nw64kt;

    /**
     * @param raw twelve source values in file order, {@value #MISSING} for not recorded
     */
    public static WindRadii fromRaw(List<Integer> raw) {
        if (raw.size() != RawObservation.WIND_RADII_COUNT) {
            throw new IllegalArgumentException("Expected 12 wind radii, got " + raw.size());
        }
        return WindRadii.builder()
                .ne34kt(orNull(raw.get(0)))
                .se34kt(orNull(raw.get(1)))
                .sw34kt(orNull(raw.get(2)))
                .nw34kt(orNull(raw.get(3)))
                .ne50kt(orNull(raw.get(4)))
                .se50kt(orNull(raw.get(5)))
                .sw50kt(orNull(raw.get(6)))
                .nw50kt(orNull(raw.get(7)))
                .ne64kt(orNull(raw.get(8)))
                .se64kt(orNull(raw.get(9)))
                .sw64kt(orNull(raw.get(10)))
                .nw64kt(orNull(raw.get(11)))
                .build();
    }

    /** Values in file order, nulls included */
    public Integer[] toArray() {
        return new Integer[]{
                ne34kt, se34kt, sw34kt, nw34kt,
                ne50kt, se50kt, sw50kt, nw50kt,
                ne64kt, se64kt, sw64kt, nw64kt
        };
    }

    private static Integer orNull(int value) {
        return value == MISSING ? null : value;
    }
}
