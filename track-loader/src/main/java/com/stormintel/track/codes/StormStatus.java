package com.stormintel.track.codes;

import com.stormintel.track.exception.UnknownCodeException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Classification of the system at the time of a best-track row.
 */
public enum StormStatus {

    TROPICAL_DEPRESSION("TD", 0, "tropical cyclone of tropical depression intensity (<34 knots)"),
    TROPICAL_STORM("TS", 1, "tropical cyclone of tropical storm intensity (34-63 knots)"),
    HURRICANE("HU", 2, "tropical cyclone of hurricane intensity (>= 64 knots)"),
    EXTRATROPICAL("EX", 3, "extratropical cyclone of any intensity"),
    SUBTROPICAL_DEPRESSION("SD", 4, "subtropical cyclone of subtropical depression intensity (<34 knots)"),
    SUBTROPICAL_STORM("SS", 5, "subtropical cyclone of subtropical storm intensity (>= 34 knots)"),
    LOW("LO", 6, "low that is neither a tropical cyclone, a subtropical cyclone, nor an extratropical cyclone"),
    TROPICAL_WAVE("WV", 7, "a tropical wave"),
    DISTURBANCE("DB", 8, "disturbance of any intensity");

    public static final String TABLE_NAME = "status";

    /**
     * Blank plus the codes only seen in the Northeast Pacific file. ET, TY, ST and PT
     * are not part of the published format, so they are treated as not recorded
     * rather than mapped to a guessed status.
     */
    public static final Set<String> MISSING_CODES = Set.of("  ", "ET", "TY", "ST", "PT");

    private static final Map<String, StormStatus> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(StormStatus::getCode, Function.identity()));

    private final String code;
    private final int id;
    private final String description;

    StormStatus(String code, int id, String description) {
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
     * @return the status for {@code code}, or {@code null} for a missing code
     * @throws UnknownCodeException when the code is in neither set
     */
    public static StormStatus decode(String code) {
        if (MISSING_CODES.contains(code)) return null;
        StormStatus status = BY_CODE.get(code);
        if (status == null) {
            throw new UnknownCodeException(TABLE_NAME, code);
        }
        return status;
    }

    public static List<CodeTableEntry> referenceTable() {
        return Arrays.stream(values())
                .map(v -> new CodeTableEntry(v.id, v.description))
                .toList();
    }
}
