package com.stormintel.track.service;

import com.stormintel.track.codes.RecordIdentifier;
import com.stormintel.track.codes.StormStatus;
import com.stormintel.track.config.TrackLoaderProperties;
import com.stormintel.track.exception.BestTrackException;
import com.stormintel.track.exception.MalformedRecordException;
import com.stormintel.track.model.BestTrackDataset;
import com.stormintel.track.model.LoadRun;
import com.stormintel.track.model.Storm;
import com.stormintel.track.output.BestTrackSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrates a load: extract and normalise every configured file, then hand the
 * combined tables to the sink.
 *
 * Files are independent, so they may be processed on a small pool; the results are
 * always combined in configured order. A file that fails is never partially written.
 * With fail-fast on, the first failure aborts the load and nothing is written;
 * otherwise the failed file is recorded and the others are written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BestTrackLoadService {

    private final BestTrackExtractor extractor;
    private final BestTrackNormalizer normalizer;
    private final BestTrackSink sink;
    private final TrackLoaderProperties properties;

    private final Deque<LoadRun> history = new ArrayDeque<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** Extract and normalise a single file. Nothing is written. */
    public BestTrackDataset process(Path file) {
        return normalizer.normalize(extractor.extract(file));
    }

    public List<LoadRun> loadConfigured() {
        List<Path> files = properties.getInput().getFiles().stream()
                .map(Paths::get)
                .toList();
        return load(files);
    }

    /**
     * @return one run per file that was processed, in file order
     * @throws BestTrackException the first file failure, when fail-fast is on
     * @throws IllegalStateException when another load is in progress
     */
    public List<LoadRun> load(List<Path> files) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A load is already running");
        }
        try {
            return doLoad(files);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Most recent runs first */
    public List<LoadRun> recentRuns() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<LoadRun> doLoad(List<Path> files) {
        if (files.isEmpty()) {
            log.warn("No best-track files configured, nothing to load");
            return List.of();
        }

        boolean failFast = properties.getLoad().isFailFast();
        int threads = Math.max(1, Math.min(properties.getLoad().getParallelism(), files.size()));
        log.info("Loading {} best-track file(s) with {} thread(s), fail-fast={}", files.size(), threads, failFast);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> processFile(file)));
            }

            List<LoadRun> runs = new ArrayList<>(files.size());
            Set<String> eventIds = new HashSet<>();
            BestTrackDataset combined = BestTrackDataset.empty();

            for (Future<FileResult> future : futures) {
                FileResult result = checkUnique(await(future), eventIds);
                runs.add(result.run());
                remember(result.run());

                if (result.error() != null) {
                    if (failFast) {
                        futures.forEach(f -> f.cancel(true));
                        log.error("Aborting load after failure in {}", result.run().getSourceFile());
                        throw result.error();
                    }
                    continue;
                }
                combined = combined.concat(result.dataset());
            }

            sink.write(combined);
            sink.writeCodeTables(RecordIdentifier.referenceTable(), StormStatus.referenceTable());

            log.info("Load complete: {} storms, {} observations from {} of {} file(s)",
                    combined.storms().size(), combined.observations().size(),
                    runs.stream().filter(r -> r.getStatus() == LoadRun.Status.SUCCESS).count(), files.size());
            return runs;
        } finally {
            pool.shutdownNow();
        }
    }

    private FileResult processFile(Path file) {
        LoadRun run = LoadRun.builder()
                .runId(UUID.randomUUID().toString())
                .sourceFile(file.toString())
                .startedAt(LocalDateTime.now())
                .status(LoadRun.Status.RUNNING)
                .build();

        try {
            BestTrackDataset dataset = process(file);
            run.setStatus(LoadRun.Status.SUCCESS);
            run.setStormCount(dataset.storms().size());
            run.setObservationCount(dataset.observations().size());
            log.info("{}: {} storms, {} observations", file, dataset.storms().size(), dataset.observations().size());
            return new FileResult(run, dataset, null);

        } catch (BestTrackException | UncheckedIOException e) {
            log.error("Failed processing {}: {}", file, e.getMessage(), e);
            run.setStatus(LoadRun.Status.FAILED);
            run.setErrorMessage(e.getMessage());
            return new FileResult(run, null, e);
        } finally {
            run.setCompletedAt(LocalDateTime.now());
        }
    }

    /** Event ids must stay unique across files too */
    private FileResult checkUnique(FileResult result, Set<String> eventIds) {
        if (result.error() != null) return result;

        for (Storm storm : result.dataset().storms()) {
            if (eventIds.contains(storm.getEventId())) {
                MalformedRecordException e = new MalformedRecordException(0,
                        "Duplicate event id " + storm.getEventId() + " in " + result.run().getSourceFile());
                log.error("Failed processing {}: {}", result.run().getSourceFile(), e.getMessage());
                result.run().setStatus(LoadRun.Status.FAILED);
                result.run().setErrorMessage(e.getMessage());
                return new FileResult(result.run(), null, e);
            }
        }
        result.dataset().storms().forEach(storm -> eventIds.add(storm.getEventId()));
        return result;
    }

    private FileResult await(Future<FileResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading best-track files", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Best-track load failed", e.getCause());
        }
    }

    private void remember(LoadRun run) {
        synchronized (history) {
            history.addFirst(run);
            while (history.size() > Math.max(1, properties.getLoad().getHistorySize())) {
                history.removeLast();
            }
        }
    }

    private record FileResult(LoadRun run, BestTrackDataset dataset, RuntimeException error) {}
}
