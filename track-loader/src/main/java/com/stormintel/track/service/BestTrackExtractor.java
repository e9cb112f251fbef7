package com.stormintel.track.service;

import com.stormintel.track.exception.MalformedRecordException;
import com.stormintel.track.model.ExtractedRecords;
import com.stormintel.track.model.RawObservation;
import com.stormintel.track.model.StormHeader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Splits a HURDAT2 file into storm headers and raw observation rows.
 *
 * The format interleaves two comma-separated shapes:
 *   AL092021,                IDA,     40,
 *   20210826, 1200,  , TD, 16.5N,  78.9W,  30, 1006,    0,    0, ...
 *
 * A line with exactly four fields (the trailing comma counts) is a header; every other
 * line is an observation of the header above it. The file is rejected on the first
 * malformed line.
 */
@Component
@Slf4j
public class BestTrackExtractor {

    static final int HEADER_FIELD_COUNT = 4;
    static final int OBSERVATION_FIELD_COUNT = 20;
    static final int EVENT_ID_LENGTH = 8;

    private static final int COL_DATE         = 0;
    private static final int COL_TIME         = 1;
    private static final int COL_IDENTIFIER   = 2;
    private static final int COL_STATUS       = 3;
    private static final int COL_LATITUDE     = 4;
    private static final int COL_LONGITUDE    = 5;
    private static final int COL_MAX_WIND     = 6;
    private static final int COL_MIN_PRESSURE = 7;
    private static final int COL_FIRST_RADIUS = 8;

    public ExtractedRecords extract(Path file) {
        log.info("Extracting {}", file);
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return extract(lines.iterator(), file.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read best-track file " + file, e);
        }
    }

    public ExtractedRecords extract(List<String> lines) {
        return extract(lines.iterator(), "<memory>");
    }

    private ExtractedRecords extract(Iterator<String> lines, String source) {
        List<StormHeader> headers = new ArrayList<>();
        List<RawObservation> observations = new ArrayList<>();
        Set<String> eventIds = new HashSet<>();

        StormBlock current = null;
        int lineNumber = 0;

        while (lines.hasNext()) {
            String line = lines.next();
            lineNumber++;
            if (line.isBlank()) continue;

            // -1 keeps the empty field after the trailing comma
            String[] fields = line.split(",", -1);

            if (fields.length == HEADER_FIELD_COUNT) {
                if (current != null) current.verifyComplete();

                StormHeader header = parseHeader(fields, lineNumber);
                if (!eventIds.add(header.getEventId())) {
                    throw new MalformedRecordException(lineNumber, "Duplicate event id " + header.getEventId());
                }
                headers.add(header);
                current = new StormBlock(header);
            } else {
                if (current == null) {
                    throw new MalformedRecordException(lineNumber, "Observation found before any storm header");
                }
                observations.add(parseObservation(fields, current.header.getEventId(), lineNumber));
                current.observed++;
            }
        }
        if (current != null) current.verifyComplete();

        log.info("Extracted {}: {} storms, {} observations", source, headers.size(), observations.size());
        return new ExtractedRecords(headers, observations);
    }

    // ── Headers ─────────────────────────────────────────────────────────────

    StormHeader parseHeader(String[] fields, int lineNumber) {
        String eventId = fields[0];
        if (eventId.length() != EVENT_ID_LENGTH) {
            throw new MalformedRecordException(lineNumber,
                    String.format("Event id '%s' is not %d characters", eventId, EVENT_ID_LENGTH));
        }

        return StormHeader.builder()
                .eventId(eventId)
                .basin(eventId.substring(0, 2))
                .stormNumber(eventId.substring(2, 4))
                .year(eventId.substring(4, 8))
                .name(fields[1].stripLeading())
                .declaredPointCount(parseInt(fields[2], "point count", lineNumber))
                .lineNumber(lineNumber)
                .build();
    }

    // ── Observations ────────────────────────────────────────────────────────

    RawObservation parseObservation(String[] fields, String eventId, int lineNumber) {
        if (fields.length < OBSERVATION_FIELD_COUNT) {
            throw new MalformedRecordException(lineNumber, String.format(
                    "Observation has %d fields, expected at least %d", fields.length, OBSERVATION_FIELD_COUNT));
        }

        String date = fields[COL_DATE];
        String time = fields[COL_TIME];
        String hours = time.stripLeading();

        List<Integer> radii = new ArrayList<>(RawObservation.WIND_RADII_COUNT);
        for (int i = 0; i < RawObservation.WIND_RADII_COUNT; i++) {
            radii.add(parseInt(fields[COL_FIRST_RADIUS + i], "wind radius", lineNumber));
        }

        return RawObservation.builder()
                .eventId(eventId)
                .lineNumber(lineNumber)
                .year(slice(date, 0, 4))
                .month(slice(date, 4, 6))
                .day(slice(date, 6, 8))
                .hour(slice(hours, 0, 2))
                .minute(last(time, 2))
                .identifierCode(lastChar(fields[COL_IDENTIFIER], "record identifier", lineNumber))
                .statusCode(last(fields[COL_STATUS], 2))
                .latitude(parseCoordinate(fields[COL_LATITUDE], 'N', 'S', "latitude", lineNumber))
                .longitude(parseCoordinate(fields[COL_LONGITUDE], 'E', 'W', "longitude", lineNumber))
                .maxWind(parseInt(fields[COL_MAX_WIND], "maximum wind", lineNumber))
                .minPressure(parseInt(fields[COL_MIN_PRESSURE], "minimum pressure", lineNumber))
                .windRadii(List.copyOf(radii))
                .build();
    }

    /**
     * Parses values like {@code " 16.5N"} or {@code "78.9W"}; the negative hemisphere flips the sign.
     */
    private double parseCoordinate(String field, char positive, char negative, String what, int lineNumber) {
        if (field.isEmpty()) {
            throw new MalformedRecordException(lineNumber, "Empty " + what);
        }
        char hemisphere = field.charAt(field.length() - 1);
        if (hemisphere != positive && hemisphere != negative) {
            throw new MalformedRecordException(lineNumber,
                    String.format("Unknown %s hemisphere '%s' in '%s'", what, hemisphere, field));
        }

        String number = field.substring(0, field.length() - 1).trim();
        try {
            double value = Double.parseDouble(number);
            return hemisphere == negative ? -value : value;
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber,
                    String.format("Unparsable %s '%s'", what, field), e);
        }
    }

    private int parseInt(String field, String what, int lineNumber) {
        try {
            return Integer.parseInt(field.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(lineNumber,
                    String.format("Unparsable %s '%s'", what, field), e);
        }
    }

    private String lastChar(String field, String what, int lineNumber) {
        if (field.isEmpty()) {
            throw new MalformedRecordException(lineNumber, "Empty " + what + " column");
        }
        return last(field, 1);
    }

    // ── Slicing ─────────────────────────────────────────────────────────────
    // Short fields give short slices; the normaliser reports them as bad timestamps.

    private static String slice(String value, int from, int to) {
        int start = Math.min(from, value.length());
        int end = Math.min(to, value.length());
        return value.substring(start, end);
    }

    private static String last(String value, int count) {
        return value.substring(Math.max(0, value.length() - count));
    }

    /** The storm whose observations are currently being read */
    private static final class StormBlock {
        private final StormHeader header;
        private int observed;

        private StormBlock(StormHeader header) {
            this.header = header;
        }

        /** The path follows the rows actually read; a wrong declared count is only reported */
        void verifyComplete() {
            if (observed == 0) {
                throw new MalformedRecordException(header.getLineNumber(),
                        "Storm " + header.getEventId() + " has no observations");
            }
            if (observed != header.getDeclaredPointCount()) {
                log.warn("Storm {} (line {}) declares {} observations but {} follow",
                        header.getEventId(), header.getLineNumber(), header.getDeclaredPointCount(), observed);
            }
        }
    }
}
