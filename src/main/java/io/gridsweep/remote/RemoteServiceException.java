package io.gridsweep.remote;

public class RemoteServiceException extends Exception {
    private final RemoteErrorCategory category;
    private final String predictionId;

    public RemoteServiceException(RemoteErrorCategory category, String message) {
        this(category, message, null, null);
    }

    public RemoteServiceException(RemoteErrorCategory category, String message, Throwable cause) {
        this(category, message, null, cause);
    }

    public RemoteServiceException(RemoteErrorCategory category, String message, String predictionId, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.predictionId = predictionId;
    }

    public RemoteErrorCategory category() {
        return category;
    }

    /** Id of the remote prediction this failure belongs to, or null when none was created. */
    public String predictionId() {
        return predictionId;
    }

    public boolean retryable() {
        return category.retryable();
    }
}
