package com.stormintel.track.codes;

import com.stormintel.track.exception.UnknownCodeException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Why a best-track row exists. Most rows are plain synoptic fixes and carry a blank code.
 */
public enum RecordIdentifier {

    CLOSEST_APPROACH("C", 0, "closest approach to a coast, not followed by a landfall"),
    GENESIS("G", 1, "genesis"),
    INTENSITY_PEAK("I", 2, "an intensity peak in terms of both pressure and wind"),
    LANDFALL("L", 3, "landfall"),
    MINIMUM_PRESSURE("P", 4, "minimum central pressure"),
    RAPID_CHANGE("R", 5, "additional detail on intensity of cyclone when rapid changes are underway"),
    STATUS_CHANGE("S", 6, "change in status of the system"),
    TRACK_DETAIL("T", 7, "provides additional detail on the track (position) of the cyclone"),
    MAXIMUM_WIND("W", 8, "maximum sustained wind speed");

    public static final String TABLE_NAME = "record identifier";

    /** Codes meaning "not recorded" */
    public static final Set<String> MISSING_CODES = Set.of(" ");

    private static final Map<String, RecordIdentifier> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RecordIdentifier::getCode, Function.identity()));

    private final String code;
    private final int id;
    private final String description;

    RecordIdentifier(String code, int id, String description) {
        this.code = code;
        this.id = id;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public int getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the identifier for {@code code}, or {@code null} for a missing code
     * @throws UnknownCodeException when the code is in neither set
     */
    public static RecordIdentifier decode(String code) {
        if (MISSING_CODES.contains(code)) return null;
        RecordIdentifier identifier = BY_CODE.get(code);
        if (identifier == null) {
            throw new UnknownCodeException(TABLE_NAME, code);
        }
        return identifier;
    }

    public static List<CodeTableEntry> referenceTable() {
        return Arrays.stream(values())
                .map(v -> new CodeTableEntry(v.id, v.description))
                .toList();
    }
}
