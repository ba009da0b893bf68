package io.gridsweep.runtime;

import io.gridsweep.combo.Combination;
import io.gridsweep.combo.CombinationBuilder;
import io.gridsweep.config.SweepConfig;
import io.gridsweep.config.SweepConfigLoader;
import io.gridsweep.config.SweepPaths;
import io.gridsweep.config.SweepSettings;
import io.gridsweep.dispatch.Dispatcher;
import io.gridsweep.dispatch.Retrier;
import io.gridsweep.dispatch.SubmissionPayloads;
import io.gridsweep.model.JobResult;
import io.gridsweep.model.JobStatus;
import io.gridsweep.observability.EventSink;
import io.gridsweep.observability.SweepEvent;
import io.gridsweep.remote.ArtifactFetcher;
import io.gridsweep.remote.RemoteJobService;
import io.gridsweep.store.ResultStore;
import io.gridsweep.store.ThumbnailGenerator;
import io.gridsweep.util.Sleeper;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wires the builder, dispatcher and result store for one sweep directory and
 * filters out combinations that an earlier run already settled.
 */
public final class SweepRunner {
    private final SweepSettings settings;
    private final RemoteJobService remote;
    private final ArtifactFetcher fetcher;
    private final ThumbnailGenerator thumbnails;
    private final Sleeper sleeper;
    private final Clock clock;
    private final EventSink events;

    public SweepRunner(
            SweepSettings settings,
            RemoteJobService remote,
            ArtifactFetcher fetcher,
            ThumbnailGenerator thumbnails,
            Sleeper sleeper,
            Clock clock,
            EventSink events
    ) {
        this.settings = settings;
        this.remote = remote;
        this.fetcher = fetcher;
        this.thumbnails = thumbnails;
        this.sleeper = sleeper;
        this.clock = clock;
        this.events = events == null ? EventSink.NOOP : events;
    }

    /** Snapshots the config, builds every combination and runs whatever is still pending. */
    public SweepReport run(SweepConfig config) throws InterruptedException {
        SweepPaths paths = SweepPaths.of(config.meta());
        new SweepConfigLoader().saveSnapshot(config, paths);
        List<Combination> combinations = CombinationBuilder.buildCombinations(config, settings.fallbackMode(), events);
        Map<String, JobResult> resumeState = settings.overwrite() ? Map.of() : resumeState(paths);
        return runSweep(config, combinations, resumeState);
    }

    public SweepReport runSweep(SweepConfig config, List<Combination> combinations, Map<String, JobResult> resumeState)
            throws InterruptedException {
        SweepPaths paths = SweepPaths.of(config.meta());
        ResultStore store = newStore(paths);
        List<Combination> pending = pending(combinations, resumeState, store);
        int settled = distinctHashes(combinations) - pending.size();
        events.emit(SweepEvent.info("sweep.start", null,
                combinations.size() + " combinations, " + pending.size() + " pending",
                Map.of("total", combinations.size(), "pending", pending.size(), "already_completed", settled)));
        if (pending.isEmpty()) {
            events.emit(SweepEvent.info("sweep.nothing_pending", null,
                    "all combinations already processed; use --overwrite to force reprocessing", Map.of()));
            return new SweepReport(paths.sweepName(), paths.sweepDir().toString(), combinations.size(), settled, List.of());
        }

        String modelId = config.meta().baseModel();
        Dispatcher dispatcher = new Dispatcher(
                new SubmissionPayloads(),
                new Retrier(settings.submitRetry(), sleeper, events),
                clock,
                events
        );
        List<JobResult> results = dispatcher.dispatch(pending, settings.concurrency(),
                payload -> remote.submit(modelId, payload), store);
        SweepReport report = new SweepReport(paths.sweepName(), paths.sweepDir().toString(),
                combinations.size(), settled, results);
        events.emit(SweepEvent.info("sweep.complete", null,
                report.count(JobStatus.SUCCEEDED) + " succeeded, " + report.count(JobStatus.FAILED) + " failed",
                Map.of("succeeded", report.count(JobStatus.SUCCEEDED), "failed", report.count(JobStatus.FAILED),
                        "skipped", report.count(JobStatus.SKIPPED))));
        return report;
    }

    /** Latest logged record per hash, used to decide what still needs to run. */
    public Map<String, JobResult> resumeState(SweepPaths paths) {
        try {
            return newStore(paths).latest();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read sweep log: " + paths.logFile(), e);
        }
    }

    /**
     * A hash is settled when its latest record succeeded or failed (failed
     * ones come back with {@code retryFailed}), or when its directory already
     * carries the completion marker. Duplicate hashes are dispatched once.
     */
    List<Combination> pending(List<Combination> combinations, Map<String, JobResult> resumeState, ResultStore store) {
        List<Combination> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Combination combination : combinations) {
            String hash = combination.hash();
            if (!seen.add(hash)) {
                continue;
            }
            if (settings.overwrite()) {
                out.add(combination);
                continue;
            }
            JobResult previous = resumeState.get(hash);
            if (previous != null && previous.status() == JobStatus.SUCCEEDED) {
                continue;
            }
            if (previous != null && previous.status() == JobStatus.FAILED && !settings.retryFailed()) {
                continue;
            }
            if (store.resultExists(hash)) {
                continue;
            }
            out.add(combination);
        }
        return out;
    }

    private ResultStore newStore(SweepPaths paths) {
        return new ResultStore(paths, fetcher, thumbnails,
                new Retrier(settings.downloadRetry(), sleeper, events), settings.overwrite(), events);
    }

    private static int distinctHashes(List<Combination> combinations) {
        return (int) combinations.stream().map(Combination::hash).distinct().count();
    }
}
