package io.gridsweep.dispatch;

import io.gridsweep.combo.Combination;
import io.gridsweep.model.JobResult;
import io.gridsweep.model.JobStatus;
import io.gridsweep.model.RemoteStatus;
import io.gridsweep.observability.EventSink;
import io.gridsweep.observability.SweepEvent;
import io.gridsweep.remote.ArtifactReference;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs pending combinations on a fixed pool of {@code concurrency} workers.
 * Each worker submits one combination at a time, so the pool size is a hard
 * ceiling on simultaneous remote calls. A failing combination yields a
 * {@code failed} result and never stops the others.
 */
public final class Dispatcher {
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final SubmissionPayloads payloads;
    private final Retrier retrier;
    private final Clock clock;
    private final EventSink events;

    public Dispatcher(SubmissionPayloads payloads, Retrier retrier, Clock clock, EventSink events) {
        this.payloads = payloads;
        this.retrier = retrier;
        this.clock = clock;
        this.events = events == null ? EventSink.NOOP : events;
    }

    public List<JobResult> dispatch(List<Combination> pending, int concurrency, JobFunction job)
            throws InterruptedException {
        return dispatch(pending, concurrency, job, ResultHandler.IDENTITY);
    }

    /**
     * @return one result per pending combination, in completion order
     * @throws InterruptedException when the calling thread is interrupted; in-flight work is abandoned
     */
    public List<JobResult> dispatch(List<Combination> pending, int concurrency, JobFunction job, ResultHandler handler)
            throws InterruptedException {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (pending.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(concurrency, pending.size());
        events.emit(SweepEvent.info("dispatch.start", null,
                "dispatching " + pending.size() + " combinations on " + workers + " workers",
                Map.of("pending", pending.size(), "concurrency", concurrency)));
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory());
        CompletionService<JobResult> completion = new ExecutorCompletionService<>(pool);
        try {
            for (Combination combination : pending) {
                completion.submit(() -> complete(runOne(combination, job), handler));
            }
            List<JobResult> results = new ArrayList<>(pending.size());
            for (int i = 0; i < pending.size(); i++) {
                Future<JobResult> done = completion.take();
                results.add(await(done));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    JobResult runOne(Combination combination, JobFunction job) throws InterruptedException {
        Instant submittedAt = clock.instant();
        Map<String, Object> payload;
        try {
            payload = payloads.toPayload(combination);
        } catch (IllegalArgumentException e) {
            events.emit(SweepEvent.error("dispatch.payload_rejected", combination.hash(), e.getMessage(), Map.of()));
            return new JobResult(JobStatus.FAILED, combination.hash(), submittedAt, Duration.ZERO,
                    combination.visibleValues(), null, null, null, "FATAL: " + e.getMessage(),
                    RemoteStatus.NOT_SUBMITTED, 0);
        }
        long started = System.nanoTime();
        Retrier.Outcome<ArtifactReference> outcome =
                retrier.run("dispatch", combination.hash(), () -> job.run(payload));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        if (outcome.ok()) {
            return JobResult.remoteSuccess(combination.hash(), submittedAt, elapsed, payload,
                    outcome.value().location(), outcome.attempts());
        }
        return JobResult.remoteFailure(combination.hash(), submittedAt, elapsed, payload,
                FailureClassifier.describe(outcome.error()), outcome.attempts());
    }

    private JobResult complete(JobResult result, ResultHandler handler) throws InterruptedException {
        try {
            return handler.handle(result);
        } catch (RuntimeException e) {
            events.emit(SweepEvent.error("dispatch.handler_failed", result.hash(),
                    "result handler failed: " + e.getMessage(), Map.of()));
            return result.persistenceFailed("result handler failed: " + e.getMessage());
        }
    }

    private static JobResult await(Future<JobResult> done) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("dispatch worker failed", cause);
        }
    }

    private static ThreadFactory threadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "gridsweep-dispatch-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
