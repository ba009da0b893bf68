package io.gridsweep.store;

import io.gridsweep.config.SweepPaths;
import io.gridsweep.dispatch.FailureClassifier;
import io.gridsweep.dispatch.ResultHandler;
import io.gridsweep.dispatch.Retrier;
import io.gridsweep.model.JobResult;
import io.gridsweep.observability.EventSink;
import io.gridsweep.observability.SweepEvent;
import io.gridsweep.remote.ArtifactFetcher;
import io.gridsweep.remote.ArtifactReference;
import io.gridsweep.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists artifacts under {@code outputs/<hash>/} and records every outcome in
 * the sweep log. {@code params.json} is written last, so its presence marks a
 * complete result directory.
 */
public final class ResultStore implements ResultHandler {
    private final SweepPaths paths;
    private final SweepLog log;
    private final ArtifactFetcher fetcher;
    private final ThumbnailGenerator thumbnails;
    private final Retrier downloadRetrier;
    private final boolean overwrite;
    private final EventSink events;

    public ResultStore(
            SweepPaths paths,
            ArtifactFetcher fetcher,
            ThumbnailGenerator thumbnails,
            Retrier downloadRetrier,
            boolean overwrite,
            EventSink events
    ) {
        this.paths = paths;
        this.events = events == null ? EventSink.NOOP : events;
        this.log = new SweepLog(paths.logFile(), this.events);
        this.fetcher = fetcher;
        this.thumbnails = thumbnails;
        this.downloadRetrier = downloadRetrier;
        this.overwrite = overwrite;
    }

    public SweepLog log() {
        return log;
    }

    @Override
    public JobResult handle(JobResult result) throws InterruptedException {
        return collect(result);
    }

    /**
     * Stores one dispatch outcome and returns the final result for it. Remote
     * failures are logged as-is; a download or write failure turns a remote
     * success into a {@code failed} record that keeps {@code remote_status}.
     */
    public JobResult collect(JobResult result) throws InterruptedException {
        if (result.failed()) {
            return record(result);
        }
        if (!overwrite && resultExists(result.hash())) {
            JobResult skipped = result.skipped("result already exists");
            events.emit(SweepEvent.info("store.skipped", result.hash(), "result directory already complete", Map.of()));
            return skipped;
        }
        if (result.resultUrl() == null) {
            return record(result.persistenceFailed("remote job returned no output"));
        }
        ArtifactReference reference = new ArtifactReference(result.resultUrl());
        Retrier.Outcome<byte[]> download = downloadRetrier.run("download", result.hash(),
                () -> fetcher.fetch(reference));
        if (!download.ok()) {
            return record(result.persistenceFailed("download failed: " + FailureClassifier.describe(download.error())));
        }
        try {
            return record(persist(result, reference.extension(), download.value()));
        } catch (PersistenceException e) {
            events.emit(SweepEvent.error("store.write_failed", result.hash(), e.getMessage(), Map.of()));
            return record(result.persistenceFailed(e.getMessage()));
        } catch (RuntimeException e) {
            String message = "failed to store result for " + result.hash() + ": " + e;
            events.emit(SweepEvent.error("store.write_failed", result.hash(), message, Map.of()));
            return record(result.persistenceFailed(message));
        }
    }

    public boolean resultExists(String hash) {
        return Files.isRegularFile(paths.paramsFile(hash));
    }

    /** Latest succeeded record per hash, in log order. */
    public Map<String, JobResult> load() throws IOException {
        Map<String, JobResult> out = new LinkedHashMap<>();
        for (JobResult row : log.replay()) {
            if (row.succeeded()) {
                out.put(row.hash(), row);
            }
        }
        return out;
    }

    /** Latest record of any status per hash. */
    public Map<String, JobResult> latest() throws IOException {
        Map<String, JobResult> out = new LinkedHashMap<>();
        for (JobResult row : log.replay()) {
            out.put(row.hash(), row);
        }
        return out;
    }

    public List<JobResult> history() throws IOException {
        return log.replay();
    }

    private JobResult persist(JobResult result, String extension, byte[] bytes) throws PersistenceException {
        String hash = result.hash();
        Path dir = paths.hashDir(hash);
        Path output = paths.outputFile(hash, extension);
        Path thumb = paths.thumbFile(hash);
        Path params = paths.paramsFile(hash);
        try {
            Files.createDirectories(dir);
            // Drop the marker first so a half-rewritten directory never looks complete.
            Files.deleteIfExists(params);
            writeAtomically(output, bytes);
            String thumbPath = null;
            if (thumbnails.generate(output, thumb)) {
                thumbPath = thumb.toString();
            } else {
                events.emit(SweepEvent.warn("store.thumbnail_skipped", hash,
                        "output is not a decodable image", Map.of("output", output.getFileName().toString())));
            }
            JobResult stored = result.persisted(output.toString(), thumbPath);
            writeAtomically(params, Jsons.toJson(stored.params()).getBytes(StandardCharsets.UTF_8));
            events.emit(SweepEvent.info("store.persisted", hash, "stored " + output.getFileName(),
                    Map.of("bytes", bytes.length)));
            return stored;
        } catch (IOException e) {
            throw new PersistenceException("failed to store result for " + hash + ": " + e.getMessage(), e);
        }
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".part");
        Files.write(temp, bytes);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private JobResult record(JobResult result) {
        try {
            log.append(result);
        } catch (IOException e) {
            throw new IllegalStateException("failed to append to " + log.file() + ": " + e.getMessage(), e);
        }
        return result;
    }
}
