package com.stormintel.track.service;

import com.stormintel.track.codes.RecordIdentifier;
import com.stormintel.track.codes.StormStatus;
import com.stormintel.track.config.TrackLoaderProperties;
import com.stormintel.track.exception.MalformedRecordException;
import com.stormintel.track.exception.UnknownCodeException;
import com.stormintel.track.model.BestTrackDataset;
import com.stormintel.track.model.LoadRun;
import com.stormintel.track.model.Storm;
import com.stormintel.track.output.BestTrackSink;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.stormintel.track.service.BestTrackExtractorTest.IDA_HEADER;
import static com.stormintel.track.service.BestTrackExtractorTest.IDA_OBSERVATION;

@ExtendWith(MockitoExtension.class)
class BestTrackLoadServiceTest {

    private static final Path SAMPLE_FILE = Path.of("src/test/resources/hurdat2-sample.txt");

    @Mock
    private BestTrackSink sink;

    @TempDir
    Path tempDir;

    private TrackLoaderProperties properties;
    private BestTrackLoadService underTest;

    @BeforeEach
    void setUp() {
        properties = new TrackLoaderProperties();
        underTest = new BestTrackLoadService(new BestTrackExtractor(), new BestTrackNormalizer(), sink, properties);
    }

    @Test
    void shouldWriteAllFilesInConfiguredOrder() throws IOException {
        Path second = write("second.txt", "AL102021,             JULIAN,      1,", IDA_OBSERVATION);
        properties.getInput().setFiles(List.of(SAMPLE_FILE.toString(), second.toString()));

        List<LoadRun> runs = underTest.loadConfigured();

        Assertions.assertEquals(2, runs.size());
        Assertions.assertTrue(runs.stream().allMatch(r -> r.getStatus() == LoadRun.Status.SUCCESS));
        Assertions.assertEquals(3, runs.get(0).getStormCount());
        Assertions.assertEquals(6, runs.get(0).getObservationCount());
        Assertions.assertNotNull(runs.get(0).getCompletedAt());

        BestTrackDataset written = captureWritten();
        Assertions.assertEquals(List.of("AL011851", "AL092021", "EP011949", "AL102021"),
                written.storms().stream().map(Storm::getEventId).toList());
        Assertions.assertEquals(7, written.observations().size());
        Mockito.verify(sink).writeCodeTables(RecordIdentifier.referenceTable(), StormStatus.referenceTable());
    }

    @Test
    void shouldKeepOrderWhenFilesRunInParallel() throws IOException {
        Path second = write("second.txt", "AL102021,             JULIAN,      1,", IDA_OBSERVATION);
        Path third = write("third.txt", "AL112021,               KATE,      1,", IDA_OBSERVATION);
        properties.getLoad().setParallelism(3);

        underTest.load(List.of(third, SAMPLE_FILE, second));

        Assertions.assertEquals(List.of("AL112021", "AL011851", "AL092021", "EP011949", "AL102021"),
                captureWritten().storms().stream().map(Storm::getEventId).toList());
    }

    @Test
    void shouldAbortWithoutWritingWhenFailFast() throws IOException {
        Path broken = write("broken.txt", IDA_HEADER, IDA_OBSERVATION.replace(" TD,", " XX,"));

        Assertions.assertThrows(UnknownCodeException.class, () -> underTest.load(List.of(SAMPLE_FILE, broken)));

        Mockito.verifyNoInteractions(sink);
        LoadRun failed = underTest.recentRuns().get(0);
        Assertions.assertEquals(LoadRun.Status.FAILED, failed.getStatus());
        Assertions.assertEquals(broken.toString(), failed.getSourceFile());
        Assertions.assertTrue(failed.getErrorMessage().contains("XX"), failed.getErrorMessage());
    }

    @Test
    void shouldWriteRemainingFilesWhenNotFailFast() throws IOException {
        Path broken = write("broken.txt", IDA_HEADER, "20210826, 1200,  , TD,");
        properties.getLoad().setFailFast(false);

        List<LoadRun> runs = underTest.load(List.of(broken, SAMPLE_FILE));

        Assertions.assertEquals(LoadRun.Status.FAILED, runs.get(0).getStatus());
        Assertions.assertTrue(runs.get(0).getErrorMessage().startsWith("line 2:"), runs.get(0).getErrorMessage());
        Assertions.assertEquals(LoadRun.Status.SUCCESS, runs.get(1).getStatus());
        Assertions.assertEquals(3, captureWritten().storms().size());
    }

    @Test
    void shouldRejectEventIdRepeatedAcrossFiles() throws IOException {
        Path repeat = write("repeat.txt", IDA_HEADER, IDA_OBSERVATION);

        MalformedRecordException e = Assertions.assertThrows(MalformedRecordException.class,
                () -> underTest.load(List.of(SAMPLE_FILE, repeat)));

        Assertions.assertTrue(e.getMessage().contains("AL092021"), e.getMessage());
        Mockito.verifyNoInteractions(sink);
    }

    @Test
    void shouldSkipRepeatedFileWhenNotFailFast() throws IOException {
        Path repeat = write("repeat.txt", IDA_HEADER, IDA_OBSERVATION);
        properties.getLoad().setFailFast(false);

        List<LoadRun> runs = underTest.load(List.of(SAMPLE_FILE, repeat));

        Assertions.assertEquals(LoadRun.Status.FAILED, runs.get(1).getStatus());
        Assertions.assertEquals(3, captureWritten().storms().size());
    }

    @Test
    void shouldFailMissingFileAsUnreadable() {
        properties.getLoad().setFailFast(false);

        List<LoadRun> runs = underTest.load(List.of(tempDir.resolve("missing.txt"), SAMPLE_FILE));

        Assertions.assertEquals(LoadRun.Status.FAILED, runs.get(0).getStatus());
        Assertions.assertEquals(LoadRun.Status.SUCCESS, runs.get(1).getStatus());
    }

    @Test
    void shouldDoNothingWithoutFiles() {
        Assertions.assertTrue(underTest.loadConfigured().isEmpty());

        Mockito.verifyNoInteractions(sink);
    }

    @Test
    void shouldKeepBoundedHistoryNewestFirst() throws IOException {
        Path second = write("second.txt", "AL102021,             JULIAN,      1,", IDA_OBSERVATION);
        properties.getLoad().setHistorySize(2);

        underTest.load(List.of(SAMPLE_FILE));
        underTest.load(List.of(SAMPLE_FILE, second));

        List<LoadRun> history = underTest.recentRuns();
        Assertions.assertEquals(2, history.size());
        Assertions.assertEquals(second.toString(), history.get(0).getSourceFile());
        Assertions.assertEquals(SAMPLE_FILE.toString(), history.get(1).getSourceFile());
        Assertions.assertFalse(underTest.isRunning());
    }

    @Test
    void shouldProcessSingleFileWithoutWriting() {
        BestTrackDataset actual = underTest.process(SAMPLE_FILE);

        Assertions.assertEquals(3, actual.storms().size());
        Mockito.verifyNoInteractions(sink);
    }

    private BestTrackDataset captureWritten() {
        ArgumentCaptor<BestTrackDataset> captor = ArgumentCaptor.forClass(BestTrackDataset.class);
        Mockito.verify(sink).write(captor.capture());
        return captor.getValue();
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, List.of(lines));
        return file;
    }
}
