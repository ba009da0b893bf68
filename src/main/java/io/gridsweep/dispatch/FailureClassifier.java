package io.gridsweep.dispatch;

import io.gridsweep.remote.RemoteErrorCategory;
import io.gridsweep.remote.RemoteServiceException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Maps a failure to a {@link RemoteErrorCategory}. Remote errors carry their
 * category; plain I/O failures count as transport errors; anything else is
 * fatal.
 */
public final class FailureClassifier {
    private FailureClassifier() {
    }

    public static Optional<RemoteErrorCategory> categorize(Throwable error) {
        if (error instanceof RemoteServiceException) {
            return Optional.of(((RemoteServiceException) error).category());
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return Optional.of(RemoteErrorCategory.TRANSIENT_TRANSPORT);
        }
        return Optional.empty();
    }

    public static boolean isRetryable(Throwable error) {
        return categorize(error).map(RemoteErrorCategory::retryable).orElse(false);
    }

    public static String describe(Throwable error) {
        String category = categorize(error).map(Enum::name).orElse("FATAL");
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return category + ": " + message;
    }
}
