package com.stormintel.track.service;

import com.stormintel.track.codes.RecordIdentifier;
import com.stormintel.track.codes.StormStatus;
import com.stormintel.track.exception.MalformedRecordException;
import com.stormintel.track.exception.TimestampException;
import com.stormintel.track.exception.UnknownCodeException;
import com.stormintel.track.geometry.Geometries;
import com.stormintel.track.geometry.StormPath;
import com.stormintel.track.geometry.TrackVertex;
import com.stormintel.track.model.BestTrackDataset;
import com.stormintel.track.model.ExtractedRecords;
import com.stormintel.track.model.Observation;
import com.stormintel.track.model.RawObservation;
import com.stormintel.track.model.Storm;
import com.stormintel.track.model.StormHeader;
import com.stormintel.track.model.WindRadii;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Turns extracted best-track rows into the typed storm and observation tables.
 *
 *  - codes are decoded through {@link RecordIdentifier} and {@link StormStatus}
 *  - -99 wind and -999 pressure / radii become null
 *  - each storm gets a point or a line through its observations, in file order
 *
 * Any bad timestamp or unknown code rejects the whole input.
 */
@Component
@Slf4j
public class BestTrackNormalizer {

    public static final int MISSING_WIND = -99;
    public static final int MISSING_PRESSURE = -999;

    public BestTrackDataset normalize(ExtractedRecords records) {
        List<Observation> observations = new ArrayList<>(records.observations().size());
        Map<String, List<Observation>> byStorm = new LinkedHashMap<>();

        for (RawObservation raw : records.observations()) {
            Observation observation = normalizeObservation(raw);
            observations.add(observation);
            byStorm.computeIfAbsent(raw.getEventId(), id -> new ArrayList<>()).add(observation);
        }

        List<Storm> storms = new ArrayList<>(records.headers().size());
        for (StormHeader header : records.headers()) {
            storms.add(buildStorm(header, byStorm.getOrDefault(header.getEventId(), List.of())));
        }

        log.debug("Normalised {} storms, {} observations", storms.size(), observations.size());
        return new BestTrackDataset(storms, observations);
    }

    Observation normalizeObservation(RawObservation raw) {
        return Observation.builder()
                .eventId(raw.getEventId())
                .pointTime(pointTime(raw))
                .identifier(decode(raw, () -> RecordIdentifier.decode(raw.getIdentifierCode())))
                .status(decode(raw, () -> StormStatus.decode(raw.getStatusCode())))
                .latitude(raw.getLatitude())
                .longitude(raw.getLongitude())
                .location(Geometries.point(raw.getLongitude(), raw.getLatitude()))
                .maxWindKnots(raw.getMaxWind() == MISSING_WIND ? null : raw.getMaxWind())
                .minPressureMb(raw.getMinPressure() == MISSING_PRESSURE ? null : raw.getMinPressure())
                .windRadii(WindRadii.fromRaw(raw.getWindRadii()))
                .build();
    }

    private Storm buildStorm(StormHeader header, List<Observation> observations) {
        if (observations.isEmpty()) {
            throw new MalformedRecordException(header.getLineNumber(),
                    "Storm " + header.getEventId() + " has no observations");
        }

        List<TrackVertex> vertices = observations.stream()
                .map(o -> new TrackVertex(o.getLongitude(), o.getLatitude(), o.getMaxWindKnots(), o.getMinPressureMb()))
                .toList();

        return Storm.builder()
                .eventId(header.getEventId())
                .basin(header.getBasin())
                .name(header.getName())
                .startTime(observations.get(0).getPointTime())
                .path(StormPath.of(vertices))
                .build();
    }

    /** {@code YYYY-MM-DDThh:mm:00.000Z} from the sliced date and time columns */
    private Instant pointTime(RawObservation raw) {
        String iso = raw.getYear() + "-" + raw.getMonth() + "-" + raw.getDay()
                + "T" + raw.getHour() + ":" + raw.getMinute() + ":00.000Z";
        try {
            return Instant.parse(iso);
        } catch (DateTimeParseException e) {
            throw new TimestampException(String.format("Storm %s, line %d: invalid timestamp '%s'",
                    raw.getEventId(), raw.getLineNumber(), iso), e);
        }
    }

    private <T> T decode(RawObservation raw, Supplier<T> lookup) {
        try {
            return lookup.get();
        } catch (UnknownCodeException e) {
            throw new UnknownCodeException(String.format("Storm %s, line %d: %s",
                    raw.getEventId(), raw.getLineNumber(), e.getMessage()), e);
        }
    }
}
