package io.gridsweep.config;

import io.gridsweep.combo.FallbackMode;
import io.gridsweep.dispatch.RetryPolicy;

import java.time.Duration;

public record SweepSettings(
        int concurrency,
        boolean overwrite,
        boolean retryFailed,
        FallbackMode fallbackMode,
        RetryPolicy submitRetry,
        RetryPolicy downloadRetry
) {
    public static final int DEFAULT_CONCURRENCY = 8;
    public static final int MAX_CONCURRENCY = 256;
    public static final int DEFAULT_SUBMIT_RETRIES = 5;
    public static final Duration DEFAULT_SUBMIT_BASE_DELAY = Duration.ofSeconds(2);
    public static final int DEFAULT_DOWNLOAD_RETRIES = 3;
    public static final Duration DEFAULT_DOWNLOAD_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final String API_TOKEN_ENV = "REPLICATE_API_TOKEN";
    public static final String API_BASE_ENV = "REPLICATE_API_BASE";
    public static final String DEFAULT_API_BASE = "https://api.replicate.com";

    public SweepSettings {
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
            throw new IllegalArgumentException(
                    "concurrency must be between 1 and " + MAX_CONCURRENCY + ", got " + concurrency);
        }
        fallbackMode = fallbackMode == null ? FallbackMode.BEST_EFFORT : fallbackMode;
        submitRetry = submitRetry == null ? defaultSubmitRetry() : submitRetry;
        downloadRetry = downloadRetry == null ? defaultDownloadRetry() : downloadRetry;
    }

    public static SweepSettings defaults() {
        return new SweepSettings(DEFAULT_CONCURRENCY, false, false, FallbackMode.BEST_EFFORT, null, null);
    }

    public SweepSettings withConcurrency(int value) {
        return new SweepSettings(value, overwrite, retryFailed, fallbackMode, submitRetry, downloadRetry);
    }

    public SweepSettings withOverwrite(boolean value) {
        return new SweepSettings(concurrency, value, retryFailed, fallbackMode, submitRetry, downloadRetry);
    }

    public SweepSettings withRetryFailed(boolean value) {
        return new SweepSettings(concurrency, overwrite, value, fallbackMode, submitRetry, downloadRetry);
    }

    public SweepSettings withFallbackMode(FallbackMode value) {
        return new SweepSettings(concurrency, overwrite, retryFailed, value, submitRetry, downloadRetry);
    }

    public SweepSettings withRetryPolicies(RetryPolicy submit, RetryPolicy download) {
        return new SweepSettings(concurrency, overwrite, retryFailed, fallbackMode, submit, download);
    }

    public static RetryPolicy defaultSubmitRetry() {
        return new RetryPolicy(DEFAULT_SUBMIT_RETRIES, DEFAULT_SUBMIT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    public static RetryPolicy defaultDownloadRetry() {
        return new RetryPolicy(DEFAULT_DOWNLOAD_RETRIES, DEFAULT_DOWNLOAD_BASE_DELAY, DEFAULT_MAX_DELAY);
    }
}
