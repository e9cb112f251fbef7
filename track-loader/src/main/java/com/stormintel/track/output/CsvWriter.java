package com.stormintel.track.output;

import com.opencsv.CSVWriter;
import com.stormintel.track.codes.CodeTableEntry;
import com.stormintel.track.config.TrackLoaderProperties;
import com.stormintel.track.geometry.Geometries;
import com.stormintel.track.model.BestTrackDataset;
import com.stormintel.track.model.Observation;
import com.stormintel.track.model.Storm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Writes the best-track tables as CSV bulk-load files.
 *
 * Output files in {outputDir}:
 *   storms.csv            event_id, basin, name, start_time, path
 *   observations.csv      event_id, point_time, identifier, status, location, wind, pressure, 12 radii
 *   identifier_codes.csv  record_id, description
 *   status_codes.csv      status_id, description
 *
 * Geometry columns are WKT in WGS84, ready for e.g.
 *   UPDATE storms SET path_geo = geography::STGeomFromText(path, 4326)
 * Missing values are written as empty cells.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter implements BestTrackSink {

    public static final String STORMS_FILE = "storms.csv";
    public static final String OBSERVATIONS_FILE = "observations.csv";
    public static final String IDENTIFIER_CODES_FILE = "identifier_codes.csv";
    public static final String STATUS_CODES_FILE = "status_codes.csv";

    private static final String[] STORM_HEADERS = {
            "event_id", "basin", "name", "start_time", "path"
    };

    private static final String[] OBSERVATION_HEADERS = {
            "event_id", "point_time", "identifier", "status", "location",
            "max_wind_knots", "min_pressure_mb",
            "ne_34kt_radii_max_nm", "se_34kt_radii_max_nm", "sw_34kt_radii_max_nm", "nw_34kt_radii_max_nm",
            "ne_50kt_radii_max_nm", "se_50kt_radii_max_nm", "sw_50kt_radii_max_nm", "nw_50kt_radii_max_nm",
            "ne_64kt_radii_max_nm", "se_64kt_radii_max_nm", "sw_64kt_radii_max_nm", "nw_64kt_radii_max_nm"
    };

    private final TrackLoaderProperties properties;

    @Override
    public void write(BestTrackDataset dataset) {
        Path outputDir = outputDir();
        writeFile(outputDir.resolve(STORMS_FILE), STORM_HEADERS, dataset.storms(), this::stormRow);
        writeFile(outputDir.resolve(OBSERVATIONS_FILE), OBSERVATION_HEADERS, dataset.observations(), this::observationRow);
    }

    @Override
    public void writeCodeTables(List<CodeTableEntry> identifiers, List<CodeTableEntry> statuses) {
        Path outputDir = outputDir();
        writeFile(outputDir.resolve(IDENTIFIER_CODES_FILE),
                new String[]{"record_id", "description"}, identifiers, this::codeRow);
        writeFile(outputDir.resolve(STATUS_CODES_FILE),
                new String[]{"status_id", "description"}, statuses, this::codeRow);
    }

    private <T> void writeFile(Path outputPath, String[] headers, List<T> rows, Function<T, String[]> mapper) {
        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(headers);
            }

            for (T row : rows) {
                writer.writeNext(mapper.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    String[] stormRow(Storm s) {
        return new String[]{
                s.getEventId(),
                s.getBasin(),
                s.getName(),
                str(s.getStartTime()),
                s.getPath().toWkt()
        };
    }

    String[] observationRow(Observation o) {
        List<String> row = new ArrayList<>(OBSERVATION_HEADERS.length);
        row.add(o.getEventId());
        row.add(str(o.getPointTime()));
        row.add(o.getIdentifier() == null ? "" : String.valueOf(o.getIdentifier().getId()));
        row.add(o.getStatus() == null ? "" : String.valueOf(o.getStatus().getId()));
        row.add(Geometries.pointWkt(o.getLongitude(), o.getLatitude()));
        row.add(str(o.getMaxWindKnots()));
        row.add(str(o.getMinPressureMb()));
        Arrays.stream(o.getWindRadii().toArray()).map(this::str).forEach(row::add);
        return row.toArray(new String[0]);
    }

    String[] codeRow(CodeTableEntry entry) {
        return new String[]{String.valueOf(entry.codeId()), entry.description()};
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private Path outputDir() {
        Path dir = Paths.get(properties.getOutput().getDir());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
        return dir;
    }
}
