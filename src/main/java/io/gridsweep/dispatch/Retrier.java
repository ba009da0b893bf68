package io.gridsweep.dispatch;

import io.gridsweep.observability.EventSink;
import io.gridsweep.observability.SweepEvent;
import io.gridsweep.util.Sleeper;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public final class Retrier {
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;
    private final EventSink events;

    public Retrier(RetryPolicy policy, Sleeper sleeper, EventSink events) {
        this(policy, sleeper, () -> ThreadLocalRandom.current().nextDouble(), events);
    }

    public Retrier(RetryPolicy policy, Sleeper sleeper, DoubleSupplier jitter, EventSink events) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.jitter = jitter;
        this.events = events == null ? EventSink.NOOP : events;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Runs {@code call} until it succeeds, fails with a non-retryable error or
     * the attempt ceiling is reached. Only the final outcome is returned.
     */
    public <T> Outcome<T> run(String action, String hash, RetryableCall<T> call) throws InterruptedException {
        Exception last = null;
        for (int attempt = 0; attempt <= policy.retries(); attempt++) {
            events.emit(SweepEvent.info(action + ".attempt", hash,
                    "attempt " + (attempt + 1) + " of " + policy.maxAttempts(), Map.of("attempt", attempt + 1)));
            try {
                T value = call.call();
                events.emit(SweepEvent.info(action + ".succeeded", hash,
                        "attempt " + (attempt + 1) + " succeeded", Map.of("attempt", attempt + 1)));
                return Outcome.success(value, attempt + 1);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                boolean retryable = FailureClassifier.isRetryable(e);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("attempt", attempt + 1);
                details.put("max_attempts", policy.maxAttempts());
                details.put("error", FailureClassifier.describe(e));
                if (!retryable || attempt == policy.retries()) {
                    events.emit(SweepEvent.error(action + ".failed", hash,
                            (retryable ? "retries exhausted: " : "fatal: ") + FailureClassifier.describe(e), details));
                    return Outcome.failure(e, attempt + 1);
                }
                Duration delay = policy.delayFor(attempt, jitter.getAsDouble());
                details.put("delay_ms", delay.toMillis());
                events.emit(SweepEvent.warn(action + ".retry", hash,
                        "attempt " + (attempt + 1) + " failed, retrying in " + delay.toMillis() + "ms", details));
                sleeper.sleep(delay);
            }
        }
        return Outcome.failure(last, policy.maxAttempts());
    }

    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws Exception;
    }

    public record Outcome<T>(T value, Exception error, int attempts) {
        static <T> Outcome<T> success(T value, int attempts) {
            return new Outcome<>(value, null, attempts);
        }

        static <T> Outcome<T> failure(Exception error, int attempts) {
            return new Outcome<>(null, error, attempts);
        }

        public boolean ok() {
            return error == null;
        }
    }
}
