package io.gridsweep.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final outcome of one combination: one per dispatch, never one per retry
 * attempt. Instances are immutable; the {@code with*} methods return copies.
 */
public record JobResult(
        JobStatus status,
        String hash,
        Instant submittedAt,
        Duration duration,
        Map<String, Object> params,
        String resultUrl,
        String outputPath,
        String thumbPath,
        String error,
        RemoteStatus remoteStatus,
        int attempts
) {
    public JobResult {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        duration = duration == null ? Duration.ZERO : duration;
        remoteStatus = remoteStatus == null ? RemoteStatus.NOT_SUBMITTED : remoteStatus;
    }

    public static JobResult remoteSuccess(
            String hash,
            Instant submittedAt,
            Duration duration,
            Map<String, Object> params,
            String resultUrl,
            int attempts
    ) {
        return new JobResult(JobStatus.SUCCEEDED, hash, submittedAt, duration, params, resultUrl,
                null, null, null, RemoteStatus.SUCCEEDED, attempts);
    }

    public static JobResult remoteFailure(
            String hash,
            Instant submittedAt,
            Duration duration,
            Map<String, Object> params,
            String error,
            int attempts
    ) {
        return new JobResult(JobStatus.FAILED, hash, submittedAt, duration, params, null,
                null, null, error, RemoteStatus.FAILED, attempts);
    }

    public JobResult persisted(String outputPath, String thumbPath) {
        return new JobResult(status, hash, submittedAt, duration, params, resultUrl,
                outputPath, thumbPath, error, remoteStatus, attempts);
    }

    public JobResult skipped(String reason) {
        return new JobResult(JobStatus.SKIPPED, hash, submittedAt, duration, params, resultUrl,
                outputPath, thumbPath, reason, remoteStatus, attempts);
    }

    /** Remote job succeeded but the artifact could not be stored locally. */
    public JobResult persistenceFailed(String reason) {
        return new JobResult(JobStatus.FAILED, hash, submittedAt, duration, params, resultUrl,
                null, null, reason, remoteStatus, attempts);
    }

    public boolean succeeded() {
        return status == JobStatus.SUCCEEDED;
    }

    public boolean failed() {
        return status == JobStatus.FAILED;
    }
}
